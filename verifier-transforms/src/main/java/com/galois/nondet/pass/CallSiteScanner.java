package com.galois.nondet.pass;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.galois.nondet.ir.CallInst;
import com.galois.nondet.ir.CastInst;
import com.galois.nondet.ir.DebugLoc;
import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.Type;
import com.galois.nondet.ir.Use;
import com.galois.nondet.ir.User;
import com.galois.nondet.ir.Value;

/**
 * Finds the calls to recognized external functions.
 *
 * <p>
 * Only functions that are declared but not defined in the module are
 * considered, and only uses in which such a function is the callee.  The
 * module is not modified.
 */
public final class CallSiteScanner {
    private final SymbolPatternRegistry registry;
    private final String entryPointName;
    private final PrintStream statusStream;

    /**
     * @param registry the recognized name patterns
     * @param entryPointName registration function; allocations already
     *   registered through it are not reported again
     * @param statusStream stream for status messages, or <code>null</code>
     */
    public CallSiteScanner(SymbolPatternRegistry registry, String entryPointName,
                           PrintStream statusStream) {
        if (registry == null) throw new NullPointerException("registry");
        if (entryPointName == null) throw new NullPointerException("entryPointName");
        this.registry = registry;
        this.entryPointName = entryPointName;
        this.statusStream = statusStream;
    }

    public CallSiteSnapshot scan(Module m) {
        List<CallSite> producers = new ArrayList<CallSite>();
        List<CallSite> allocators = new ArrayList<CallSite>();

        for (Function f : m.getFunctions()) {
            if (!f.isDeclaration()) {
                continue;
            }
            CallSiteKind kind = registry.lookup(f.getName());
            if (kind == null) {
                continue;
            }
            if (kind.getCategory() == CallSite.Category.PRODUCER && !f.getReturnType().isSized()) {
                logStatus(String.format("skipping %s: it returns no value", f.getName()));
                continue;
            }

            for (Use u : f.getUses()) {
                if (!CallInst.isCallee(u)) {
                    continue;
                }
                CallInst call = (CallInst) u.getUser();
                if (call.getParent() == null) {
                    continue;
                }
                if (kind.getCategory() == CallSite.Category.ALLOCATOR) {
                    if (!isAllocationCall(call, kind)) {
                        logStatus(String.format("skipping call to %s in %s: unexpected signature",
                                                f.getName(), call.getFunction().getName()));
                        continue;
                    }
                    if (isRegistered(call)) {
                        continue;
                    }
                    allocators.add(new CallSite(kind, lineOf(call), call));
                } else {
                    producers.add(new CallSite(kind, lineOf(call), call));
                }
            }
        }
        return new CallSiteSnapshot(producers, allocators);
    }

    private static int lineOf(CallInst call) {
        DebugLoc loc = call.getDebugLoc();
        return loc == null ? CallSite.UNKNOWN_LINE : loc.getLine();
    }

    // The call must return memory and take its byte count in integer arguments.
    private static boolean isAllocationCall(CallInst call, CallSiteKind kind) {
        if (!call.type().isPointer()) {
            return false;
        }
        int cnt = kind.getSizeArgCount();
        if (call.getNumArgOperands() < cnt) {
            return false;
        }
        for (int i = 0; i != cnt; ++i) {
            if (!call.getArgOperand(i).type().isInteger()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether the result of <code>call</code> is already passed, directly or
     * through a pointer cast, as the address argument of the entry point.
     */
    private boolean isRegistered(CallInst call) {
        for (User user : call.getUsers()) {
            if (isEntryPointAddress(user, call)) {
                return true;
            }
            if (user instanceof CastInst && user.type().equals(Type.I8_PTR)) {
                for (User castUser : user.getUsers()) {
                    if (isEntryPointAddress(castUser, user)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean isEntryPointAddress(User user, Value addr) {
        if (!(user instanceof CallInst)) {
            return false;
        }
        CallInst c = (CallInst) user;
        Function callee = c.getCalledFunction();
        return callee != null
            && callee.getName().equals(entryPointName)
            && c.getNumArgOperands() > 0
            && c.getArgOperand(0) == addr;
    }

    private void logStatus(String msg) {
        if (statusStream != null) {
            statusStream.printf("%s: %s%n", ReplaceVerifierFuns.NAME, msg);
            statusStream.flush();
        }
    }
}
