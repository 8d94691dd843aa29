package com.example.orderdesk.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI orderDeskOpenAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Order Desk API")
                        .description("""
                                學術訂單工作流程 API

                                ## 流程

                                `詢價 → 報價 → 付款確認（核發工作代碼）→ 招募寫手 → 品質審核 → 交付`

                                ## 說明

                                - 呼叫者身分由 **X-User-Id** header 提供，角色一律向身分服務查詢
                                - 狀態變更皆以預期狀態或版本號做比對寫入，衝突回傳 409
                                - 每個成功操作寫入一筆稽核紀錄，並通知相關使用者
                                - 建立詢價與提交付款支援 **X-Idempotency-Key**
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Order Desk Team")
                                .email("order-desk@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local Development")
                ));
    }
}
