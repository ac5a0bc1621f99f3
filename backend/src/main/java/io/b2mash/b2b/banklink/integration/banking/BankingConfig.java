package io.b2mash.b2b.banklink.integration.banking;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class BankingConfig {

  /** Bank API client with bounded timeouts; a timeout surfaces as a failed call, never a retry. */
  @Bean
  RestClient bankRestClient(RestClient.Builder builder, BankingProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.apiBaseUrl()).requestFactory(requestFactory).build();
  }
}
