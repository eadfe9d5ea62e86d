/** Retry drivers that wait by blocking the calling thread. */
package com.example.backoff.core.blocking;
