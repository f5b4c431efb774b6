package com.lmbridge.hooks;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Per-invocation view of a query handed to db hooks.
 *
 * Created fresh for every query call. The pipeline updates {@code sql}, {@code args} and
 * {@code poolKey} after each before-hook stage; after-hooks should treat it as read-only.
 */
@Data
@Builder
public class QueryContext {
    private String providerName;
    private String sql;
    private List<Object> args;
    private String sqlFile;
    private String poolKey;
}
