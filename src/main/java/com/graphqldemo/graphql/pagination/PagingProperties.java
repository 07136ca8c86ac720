package com.graphqldemo.graphql.pagination;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "paging")
@Data
public class PagingProperties {
    private int defaultSize = 10;
    private int maxSize = 50;
}
