/**
 * Socket provisioning: binding fresh sockets or adopting descriptors inherited through
 * socket activation, with native validation of anything inherited.
 */
package com.questrail.echosrv.net;
