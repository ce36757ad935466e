package io.marketsync.cache;

/** VOLATILE entries live for the process only; DURABLE entries are also on disk. */
public enum CacheTier { VOLATILE, DURABLE }
