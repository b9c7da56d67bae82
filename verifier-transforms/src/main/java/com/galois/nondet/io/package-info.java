/**
 * Reading and writing modules in their protocol buffer form.
 */
package com.galois.nondet.io;
