package com.purchasingpower.archiverag.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ResolverProperties resolver = new ResolverProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private QueryProperties query = new QueryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AuditProperties audit = new AuditProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EntityStoreProperties entityStore = new EntityStoreProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetrievalProperties retrieval = new RetrievalProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GenerationProperties generation = new GenerationProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private QuantitativeProperties quantitative = new QuantitativeProperties();
}
