package inbox.triage.app.config;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.ClientParametersAuthentication;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import inbox.triage.app.service.GmailMailStore;
import inbox.triage.app.service.MailStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gmail client for the single mailbox the triage runs against. The refresh token is
 * exchanged for access tokens on demand by the client library.
 */
@Slf4j
@Configuration
public class GmailConfig {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Inbox Triage";
    private static final String TOKEN_SERVER_URL = "https://oauth2.googleapis.com/token";

    @Bean
    public Gmail gmail(
            @Value("${gmail.client-id:}") String clientId,
            @Value("${gmail.client-secret:}") String clientSecret,
            @Value("${gmail.refresh-token:}") String refreshToken) throws Exception {
        if (clientId.isEmpty() || clientSecret.isEmpty() || refreshToken.isEmpty()) {
            log.warn("Gmail OAuth credentials not configured. Set gmail.client-id, gmail.client-secret and gmail.refresh-token.");
        }

        NetHttpTransport httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(httpTransport)
                .setJsonFactory(JSON_FACTORY)
                .setTokenServerEncodedUrl(TOKEN_SERVER_URL)
                .setClientAuthentication(new ClientParametersAuthentication(clientId, clientSecret))
                .build();
        credential.setRefreshToken(refreshToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    @Bean
    public MailStore mailStore(Gmail gmail) {
        return new GmailMailStore(gmail);
    }
}
