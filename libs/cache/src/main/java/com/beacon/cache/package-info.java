/**
 * Redis support for Beacon services: the {@code redis} dependency clients and a counter store
 * backed by Redis {@code INCR}.
 */
package com.beacon.cache;
