package com.graphqldemo.graphql.pagination;

public record PageRequest(int offset, int limit) {
}
