/**
 * Immutable domain types shared by search, acquisition and job tracking.
 */
package com.phillippitts.audiofetch.domain;
