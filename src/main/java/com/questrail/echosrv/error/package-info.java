/**
 * Failure Taxonomy
 * =============================================================================
 *
 * <p>Every failure the engine raises is an unchecked {@link com.questrail.echosrv.error.EchoException}.
 * Transports translate their own errors into these types, so servers and clients never
 * branch on which transport produced a failure.</p>
 *
 * <ul>
 *   <li>{@link com.questrail.echosrv.error.BindFailedException}: a fresh socket could not be bound</li>
 *   <li>{@link com.questrail.echosrv.error.FdInheritanceException}: an inherited descriptor was unusable</li>
 *   <li>{@link com.questrail.echosrv.error.EchoIoException}: socket I/O failed</li>
 *   <li>{@link com.questrail.echosrv.error.EchoTimeoutException}: a deadline lapsed</li>
 *   <li>{@link com.questrail.echosrv.error.EchoConfigException}: invalid configuration or request</li>
 *   <li>{@link com.questrail.echosrv.error.PayloadTooLargeException}: a size ceiling was exceeded</li>
 * </ul>
 */
package com.questrail.echosrv.error;
