/**
 * Runtime-mutable provider membership, observable separately from the providers' own changes.
 */
package io.fullerstack.composite.membership;
