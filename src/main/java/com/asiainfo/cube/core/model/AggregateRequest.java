package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.CubeConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * 聚合查询请求
 *
 * @param measure    聚合的度量，默认 amount
 * @param drilldowns 分组维度（字段名或 dimension.attribute）
 * @param cuts       等值过滤；同一列的多个值 OR，不同列之间 AND
 * @param page       页码，从 1 开始
 * @param pagesize   每页条数，null 表示使用配置默认值
 * @param order      排序；为空时按度量降序
 */
public record AggregateRequest(
    String measure,
    List<String> drilldowns,
    List<Cut> cuts,
    int page,
    Integer pagesize,
    List<Order> order
) {
    public AggregateRequest {
        measure = measure == null || measure.isEmpty() ? CubeConstants.DEFAULT_MEASURE : measure;
        drilldowns = drilldowns == null ? List.of() : List.copyOf(drilldowns);
        cuts = cuts == null ? List.of() : List.copyOf(cuts);
        order = order == null ? List.of() : List.copyOf(order);
    }

    public record Cut(String key, Object value) {
    }

    public record Order(String key, boolean descending) {
        public static Order asc(String key) {
            return new Order(key, false);
        }

        public static Order desc(String key) {
            return new Order(key, true);
        }
    }

    public AggregateRequest withPagesize(int pagesize) {
        return new AggregateRequest(measure, drilldowns, cuts, page, pagesize, order);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String measure;
        private final List<String> drilldowns = new ArrayList<>();
        private final List<Cut> cuts = new ArrayList<>();
        private int page = 1;
        private Integer pagesize;
        private final List<Order> order = new ArrayList<>();

        public Builder measure(String measure) {
            this.measure = measure;
            return this;
        }

        public Builder drilldown(String... keys) {
            drilldowns.addAll(List.of(keys));
            return this;
        }

        public Builder cut(String key, Object value) {
            cuts.add(new Cut(key, value));
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder pagesize(int pagesize) {
            this.pagesize = pagesize;
            return this;
        }

        public Builder order(String key, boolean descending) {
            order.add(new Order(key, descending));
            return this;
        }

        public AggregateRequest build() {
            return new AggregateRequest(measure, drilldowns, cuts, page, pagesize, order);
        }
    }
}
