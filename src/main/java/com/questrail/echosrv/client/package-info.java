/**
 * Blocking clients for stream and datagram servers.
 */
package com.questrail.echosrv.client;
