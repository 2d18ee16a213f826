package org.webcdu.cdu;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CDU 转换服务的 Bean 装配：把 {@link CduServerProperties} 注入到路径解析器与转换器中。
 */
@Configuration(proxyBeanMethods = false)
public class CduServerConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(CduServerProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public CduConverter cduConverter(CduServerProperties properties) {
        return new CduConverter(new CduConverter.Options(
                properties.getSectionMarker(),
                properties.getContinuationProfile(),
                properties.getMaxDiagnostics()
        ));
    }
}
