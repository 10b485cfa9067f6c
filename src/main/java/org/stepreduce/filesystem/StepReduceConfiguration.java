package org.stepreduce.filesystem;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.stepreduce.step.StepReducer;

/**
 * STEP 精简服务的 Bean 装配：路径解析器与带默认选项的精简器都从 {@link StepReduceProperties} 构建。
 */
@Configuration(proxyBeanMethods = false)
public class StepReduceConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(StepReduceProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public StepReducer stepReducer(StepReduceProperties properties) {
        return new StepReducer(properties.toReduceOptions());
    }
}
