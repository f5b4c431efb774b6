package com.lmbridge.intercept;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryPipeline")
class QueryPipelineTest {

    private static QueryInterceptor recording(String name, List<String> trace) {
        return new QueryInterceptor() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<Map<String, Object>> intercept(QueryInvocation invocation, QueryChain chain) throws SQLException {
                trace.add(name + ">");
                List<Map<String, Object>> rows = chain.proceed(invocation.withStatement(invocation.getSql() + " " + name, invocation.getArgs()));
                trace.add("<" + name);
                return rows;
            }
        };
    }

    @Test
    @DisplayName("runs interceptors outermost first and ends in the executor")
    void order() throws Exception {
        List<String> trace = new ArrayList<>();
        List<String> executed = new ArrayList<>();
        QueryPipeline pipeline = new QueryPipeline(
                List.of(recording("a", trace), recording("b", trace)),
                invocation -> {
                    executed.add(invocation.getSql());
                    return List.of(Map.of("n", 1));
                });

        List<Map<String, Object>> rows = pipeline.execute(QueryInvocation.builder().sql("q").args(List.of()).build());

        assertThat(trace).containsExactly("a>", "b>", "<b", "<a");
        assertThat(executed).containsExactly("q a b");
        assertThat(rows).hasSize(1);
        assertThat(pipeline.getInterceptorNames()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("calls the executor directly without interceptors")
    void noInterceptors() throws Exception {
        QueryPipeline pipeline = new QueryPipeline(null, invocation -> List.of());

        assertThat(pipeline.execute(QueryInvocation.builder().sql("q").build())).isEmpty();
    }

    @Test
    @DisplayName("copies statements with null arguments")
    void withStatementAllowsNullArgs() {
        QueryInvocation invocation = QueryInvocation.builder().sql("q").args(List.of()).build();
        List<Object> args = new ArrayList<>();
        args.add(null);

        QueryInvocation copy = invocation.withStatement("q2", args);

        assertThat(copy.getArgs()).hasSize(1).containsNull();
        assertThat(copy.getSql()).isEqualTo("q2");
    }
}
