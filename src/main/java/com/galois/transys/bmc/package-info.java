/**
 * The bounded model checking engine and its supervisor protocol.
 *
 * <p>
 * To check properties, create a {@link com.galois.transys.bmc.Bmc} and call
 * {@link com.galois.transys.bmc.Bmc#run} with an
 * {@link com.galois.transys.bmc.EventChannel} carrying events out and
 * control messages in.
 */
package com.galois.transys.bmc;
