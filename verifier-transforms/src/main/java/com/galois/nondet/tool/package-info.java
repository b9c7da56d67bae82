/**
 * Command line entry point.
 */
package com.galois.nondet.tool;
