/**
 * RetroAuto exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.retroauto.exception.RetroAutoException} - base for all engine errors</li>
 *   <li>{@link com.phillippitts.retroauto.exception.ParseException} - fatal, load time, carries line/column</li>
 *   <li>{@link com.phillippitts.retroauto.exception.ScriptExecutionException} - fatal, runtime, carries
 *       flow name and instruction index</li>
 *   <li>{@link com.phillippitts.retroauto.exception.RecursionLimitException} - fatal call stack overflow</li>
 *   <li>{@link com.phillippitts.retroauto.exception.ImageNotFoundException} - recoverable per on_error policy</li>
 *   <li>{@link com.phillippitts.retroauto.exception.AssetMissingException} - fatal unless tolerated</li>
 *   <li>{@link com.phillippitts.retroauto.exception.ActionFailedException} - primitive action failure</li>
 *   <li>{@link com.phillippitts.retroauto.exception.InterruptConflictException} - arbitration invariant breach</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support cause chaining.
 *
 * @since 1.0
 */
package com.phillippitts.retroauto.exception;
