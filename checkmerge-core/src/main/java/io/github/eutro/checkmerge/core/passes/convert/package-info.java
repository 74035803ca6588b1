/**
 * Passes that convert into the IR from other forms.
 */
package io.github.eutro.checkmerge.core.passes.convert;
