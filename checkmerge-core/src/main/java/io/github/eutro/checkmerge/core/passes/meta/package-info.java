/**
 * Passes that compute metadata about the IR, without changing its instructions.
 */
package io.github.eutro.checkmerge.core.passes.meta;
