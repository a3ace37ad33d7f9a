package zoho.contacts.app.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.Credential;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthorizationServiceTest {

    @Mock
    private TokenRefreshService tokenRefreshService;

    @Mock
    private AuthorizationCodeListener codeListener;

    private AuthorizationService authorizationService;

    @BeforeEach
    void setUp() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getAuth().setCallbackTimeout(Duration.ofSeconds(42));
        authorizationService = new AuthorizationService(tokenRefreshService, codeListener, properties);
    }

    @Test
    void ensureAuthorized_WithTokenAlreadyLoaded_ShouldNotReloadFromStore() {
        // Given
        when(tokenRefreshService.getState()).thenReturn(TokenRefreshService.State.VALID);

        // When
        authorizationService.ensureAuthorized();

        // Then
        verify(tokenRefreshService, never()).loadStoredCredential();
        verifyNoInteractions(codeListener);
    }

    @Test
    void ensureAuthorized_WithStoredToken_ShouldSkipBrowserFlow() {
        // Given
        when(tokenRefreshService.loadStoredCredential()).thenReturn(true);

        // When
        authorizationService.ensureAuthorized();

        // Then
        verifyNoInteractions(codeListener);
        verify(tokenRefreshService, never()).exchangeCode(anyString());
    }

    @Test
    void ensureAuthorized_WithoutToken_ShouldWaitForCodeAndExchangeIt() {
        // Given
        when(tokenRefreshService.loadStoredCredential()).thenReturn(false);
        when(tokenRefreshService.buildAuthorizationUrl()).thenReturn("https://accounts.zoho.in/oauth/v2/auth?x=1");
        when(codeListener.await(Duration.ofSeconds(42))).thenReturn("code-1");
        when(tokenRefreshService.exchangeCode("code-1")).thenReturn(new Credential());

        // When
        authorizationService.ensureAuthorized();

        // Then
        verify(codeListener).begin();
        verify(tokenRefreshService).exchangeCode("code-1");
    }

    @Test
    void ensureAuthorized_WhenCallbackTimesOut_ShouldPropagateAuthException() {
        // Given
        when(tokenRefreshService.loadStoredCredential()).thenReturn(false);
        when(tokenRefreshService.buildAuthorizationUrl()).thenReturn("https://accounts.zoho.in/oauth/v2/auth");
        when(codeListener.await(any(Duration.class))).thenThrow(new AuthException("Timeout waiting for authorization code"));

        // When & Then
        assertThrows(AuthException.class, () -> authorizationService.ensureAuthorized());
        verify(tokenRefreshService, never()).exchangeCode(anyString());
    }
}
