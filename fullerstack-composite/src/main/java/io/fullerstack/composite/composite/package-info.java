/**
 * Aggregation of many providers into one cached, invalidatable snapshot.
 *
 * <p>Data flow: providers → one {@link io.fullerstack.composite.watch.SourceWatcher} per provider
 * → recompute → new epoch (snapshot plus fresh signal) → the previous epoch's signal fires →
 * consumers re-read and re-subscribe.
 *
 * @see io.fullerstack.composite.composite.CompositeProvider
 */
package io.fullerstack.composite.composite;
