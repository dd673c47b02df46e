package com.jdc.foodgram.config;

import lombok.Getter; import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.catalog")
@Getter @Setter
public class CatalogProperties {
    private boolean importOnStartup = false;
    private String ingredientsPath = "data/ingredients.csv";
    private String tagsPath = "data/tags.csv";
}
