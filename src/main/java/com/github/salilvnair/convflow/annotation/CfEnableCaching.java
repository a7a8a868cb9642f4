package com.github.salilvnair.convflow.annotation;

import com.github.salilvnair.convflow.config.ConvFlowCacheConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable caching of flow node and flow graph lookups so the navigation
 * state machine does not hit the relational store on every transition.
 * This internally triggers Spring Boot's generic
 * {@link org.springframework.cache.annotation.EnableCaching}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ConvFlowCacheConfiguration.class)
public @interface CfEnableCaching {
}
