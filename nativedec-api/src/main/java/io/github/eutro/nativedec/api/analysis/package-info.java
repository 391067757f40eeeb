/**
 * Interfaces of the external analyzers the decompiler pipeline delegates to.
 */
package io.github.eutro.nativedec.api.analysis;
