package com.myorg.tocparser.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where the REST layer writes the interchange JSON.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "toc.storage")
public class StorageProperties {

    private String basePath = "output";

    private String treeFileName = "toc_tree.json";
}
