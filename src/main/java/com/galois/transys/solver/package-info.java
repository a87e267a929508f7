/**
 * Incremental solver sessions: Z3 in process, or any SMT-LIB 2 solver as a
 * child process.
 */
package com.galois.transys.solver;
