package com.github.salilvnair.convflow.annotation;

import com.github.salilvnair.convflow.config.ConvFlowAutoConfiguration;
import org.springframework.context.annotation.Import;
import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ConvFlowAutoConfiguration.class)
public @interface EnableConvFlow {
}
