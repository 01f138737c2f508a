/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.vadbridge.exception.VadBridgeException}
 * and carries the {@link com.phillippitts.vadbridge.exception.ErrorCode} that the boundary
 * returns for it. None of them ever crosses the boundary: the
 * {@link com.phillippitts.vadbridge.service.boundary.VadBridge} implementations catch them,
 * record the message as the session's last error and return the numeric code.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.vadbridge.exception.HandleNotFoundException} - unknown or destroyed handle</li>
 *   <li>{@link com.phillippitts.vadbridge.exception.SessionStateException} - operation illegal in the current state</li>
 *   <li>{@link com.phillippitts.vadbridge.exception.HostUnavailableException} - thread attachment failed</li>
 *   <li>{@link com.phillippitts.vadbridge.exception.ConfigurationRejectedException} - engine refused the configuration</li>
 *   <li>{@link com.phillippitts.vadbridge.exception.EngineInitializationException} - engine or model failed to load
 *       ({@link com.phillippitts.vadbridge.exception.ModelNotFoundException} for missing model files)</li>
 *   <li>{@link com.phillippitts.vadbridge.exception.AudioProcessingException} - engine failed while processing</li>
 *   <li>{@link com.phillippitts.vadbridge.exception.AllocationFailedException} - registry capacity exhausted</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.vadbridge.exception;
