/**
 * Transition systems and the properties checked on them.
 */
package com.galois.transys.sys;
