/**
 * The pass abstraction the decompiler pipeline is built from.
 */
package io.github.eutro.nativedec.core.passes;
