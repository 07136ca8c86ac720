package com.graphqldemo.common.page;

public enum SortDirection {
    ASC,
    DESC
}
