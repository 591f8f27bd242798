/**
 * The reports produced for analysed regions.
 */
package io.github.eutro.funcextract.core.report;
