package com.lmbridge.hooks;

/**
 * Hook that overrides nothing.
 */
public class EmptyHook implements DbHook {
}
