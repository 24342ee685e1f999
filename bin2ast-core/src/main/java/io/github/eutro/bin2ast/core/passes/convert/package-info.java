/**
 * Passes that convert a control flow graph to statements.
 *
 * @see io.github.eutro.bin2ast.core.passes.convert.LowerCfg
 */
package io.github.eutro.bin2ast.core.passes.convert;
