package com.edgewatch.service.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    /** Omits nulls and writes decimals in plain notation so query values keep their exact digits. */
    @Bean
    public static BeanPostProcessor objectMapperCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
                    om.configure(SerializationFeature.WRITE_NULL_MAP_VALUES, false);
                    om.configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
                }
                return bean;
            }
        };
    }
}
