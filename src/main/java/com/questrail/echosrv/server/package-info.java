/**
 * Connection servers for stream and datagram transports, their per-connection
 * sessions, admission control and the shutdown signal.
 */
package com.questrail.echosrv.server;
