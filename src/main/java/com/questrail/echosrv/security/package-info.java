/**
 * Resource-limiting collaborators: connection slots, per-second rate limiting and size
 * checks. Available to embedding code; the servers enforce their own connection limit.
 */
package com.questrail.echosrv.security;
