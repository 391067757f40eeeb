/**
 * The intermediate representation (IR) analysed by the decompiler.
 * <p>
 * A {@link io.github.eutro.nativedec.core.ir.Program} is a set of
 * {@link io.github.eutro.nativedec.core.ir.BasicBlock basic blocks} produced by
 * the instruction lifter. The function partitioner groups them into
 * {@link io.github.eutro.nativedec.core.ir.Function functions}.
 * Each block holds a list of {@link io.github.eutro.nativedec.core.ir.Statement statements},
 * which are built of {@link io.github.eutro.nativedec.core.ir.Term terms}.
 * <p>
 * Statements and terms are identity objects. Analyses key their results by the
 * node itself (never by structural equality), or by the node's
 * {@link io.github.eutro.nativedec.core.ir.Term#getId() integer handle}.
 * A term's read/write direction is fixed when its statement is constructed.
 */
package io.github.eutro.nativedec.core.ir;
