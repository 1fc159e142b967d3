package com.example.clubservice.config;

import com.example.clubservice.tenant.TenantContextInterceptor;
import com.example.clubservice.tenant.TenantScopedRequestArgumentResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Registers the tenant context interceptor and its controller argument resolver.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final TenantContextInterceptor tenantContextInterceptor;
    private final TenantScopedRequestArgumentResolver tenantScopedRequestArgumentResolver;

    public WebMvcConfig(TenantContextInterceptor tenantContextInterceptor,
                        TenantScopedRequestArgumentResolver tenantScopedRequestArgumentResolver) {
        this.tenantContextInterceptor = tenantContextInterceptor;
        this.tenantScopedRequestArgumentResolver = tenantScopedRequestArgumentResolver;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(tenantContextInterceptor).addPathPatterns("/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(tenantScopedRequestArgumentResolver);
    }
}
