package com.servicedesk.automation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI serviceDeskOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Service Desk Automation API")
                        .version("1.0.0")
                        .description(
                                "Turns support emails into IT service desk tickets and tracks their SLAs.\n\n" +
                                "**Ticket lifecycle:**\n" +
                                "1. Emails are pulled from the inbox by `POST /ingestion/run` (or the timer)\n" +
                                "2. Ordered keyword rules classify each email into a category and priority\n" +
                                "3. **LOW** tickets are auto-resolved, **MEDIUM** tickets are assigned to the " +
                                "category's team, **HIGH** tickets are escalated at once\n" +
                                "4. Agents close tickets with `POST /tickets/{id}/resolve`\n\n" +
                                "**SLA monitoring:**\n" +
                                "- `POST /sla/sweep` flags response and resolution breaches and sends " +
                                "approaching-breach warnings, each at most once per ticket\n" +
                                "- A resolution breach escalates the ticket and raises its priority to HIGH\n\n" +
                                "Resolved and auto-resolved tickets are final and cannot be changed.")
                        .contact(new Contact().name("Service Desk Platform Team")));
    }
}
