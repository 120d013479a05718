/**
 * Servlet plumbing shared by Beacon services: correlation IDs and RFC 7807 error responses.
 */
package com.beacon.web;
