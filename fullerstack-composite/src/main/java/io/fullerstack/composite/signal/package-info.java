/**
 * One-shot change signals: ARMED until fired, fired at most once, never re-armed.
 */
package io.fullerstack.composite.signal;
