package io.shopfront.fulfillment.customer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class HttpCustomerDirectoryTest {
    private static final String BASE_URL = "http://users.test";

    private MockRestServiceServer server;
    private HttpCustomerDirectory customerDirectory;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        customerDirectory = new HttpCustomerDirectory(builder, BASE_URL);
    }

    @Test
    @DisplayName("Should read the profile returned by the user service")
    void findProfile_found() {
        server.expect(requestTo(BASE_URL + "/users/user-1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(
                        "{\"userId\":\"user-1\",\"shortId\":\"U1\",\"name\":\"Asha\",\"email\":\"asha@example.com\",\"mobile\":\"9999999999\"}",
                        MediaType.APPLICATION_JSON));

        Optional<CustomerProfile> profile = customerDirectory.findProfile("user-1");

        assertThat(profile).isPresent();
        assertThat(profile.get().getName()).isEqualTo("Asha");
        assertThat(profile.get().getShortId()).isEqualTo("U1");
        server.verify();
    }

    @Test
    void findProfile_notFound() {
        server.expect(requestTo(BASE_URL + "/users/ghost")).andRespond(withResourceNotFound());

        assertThat(customerDirectory.findProfile("ghost")).isEmpty();
        server.verify();
    }

    @Test
    void findProfile_serverError() {
        server.expect(requestTo(BASE_URL + "/users/user-1")).andRespond(withServerError());

        assertThat(customerDirectory.findProfile("user-1")).isEmpty();
    }

    @Test
    void findProfile_blankUser() {
        assertThat(customerDirectory.findProfile(" ")).isEmpty();
        server.verify();
    }
}
