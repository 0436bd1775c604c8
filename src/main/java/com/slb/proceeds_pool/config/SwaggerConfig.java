package com.slb.proceeds_pool.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    private static final String SECURITY_SCHEME_NAME = "BearerAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("收益池后端服务 API / Proceeds Pool API")
                        .version("1.0.0")
                        .description(
                                """
                                收益池：用户按 1:1 存入底层资产获得份额，池子管理账户注入的收益按注入时刻的份额比例分配。
                                Proceeds pool: deposits mint claim units 1:1; injected proceeds are shared pro rata
                                to the holdings at injection time.
                                
                                - 金额均为底层资产最小单位的整数（字符串或数字均可）。/ Amounts are integer base units.
                                - 所有接口统一返回 ApiResponse<T>：code=0 表示成功；失败时 message 为稳定机器码
                                  （ZERO_AMOUNT / ZERO_ADDRESS / INSUFFICIENT_BALANCE / TRANSFER_FAILED / NOT_PRIVILEGED ...）。
                                - 失败的操作不会留下任何部分状态。/ Failed operations leave no partial state.
                                """
                        )
                )
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("在此处输入 JWT 访问令牌，格式为：Bearer {token}")
                        )
                );
    }
}
