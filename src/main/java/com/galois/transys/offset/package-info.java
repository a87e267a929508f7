/**
 * Unrolling depths and the offsets a formula refers to.
 */
package com.galois.transys.offset;
