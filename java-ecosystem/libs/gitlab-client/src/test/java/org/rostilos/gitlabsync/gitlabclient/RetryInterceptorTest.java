package org.rostilos.gitlabsync.gitlabclient;

import okhttp3.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryInterceptorTest {

    @Mock
    private Interceptor.Chain chain;

    private final Request request = new Request.Builder().url("https://gitlab.example.com/api/v4/user").build();

    @Test
    void testIntercept_ConnectionFailureThenSuccess_Retries() throws IOException {
        when(chain.request()).thenReturn(request);
        when(chain.proceed(request))
                .thenThrow(new IOException("connection reset"))
                .thenReturn(response(200));

        Response result = new RetryInterceptor(2, 1).intercept(chain);

        assertThat(result.code()).isEqualTo(200);
        verify(chain, times(2)).proceed(request);
    }

    @Test
    void testIntercept_RetriesExhausted_ReturnsLastResponse() throws IOException {
        when(chain.request()).thenReturn(request);
        when(chain.proceed(request)).thenReturn(response(429), response(429), response(429));

        Response result = new RetryInterceptor(2, 1).intercept(chain);

        assertThat(result.code()).isEqualTo(429);
        verify(chain, times(3)).proceed(request);
    }

    @Test
    void testIntercept_ClientError_IsNotRetried() throws IOException {
        when(chain.request()).thenReturn(request);
        when(chain.proceed(request)).thenReturn(response(404));

        Response result = new RetryInterceptor(3, 1).intercept(chain);

        assertThat(result.code()).isEqualTo(404);
        verify(chain, times(1)).proceed(request);
    }

    @Test
    void testIntercept_NoRetries_PropagatesFailure() throws IOException {
        when(chain.request()).thenReturn(request);
        when(chain.proceed(request)).thenThrow(new IOException("unreachable"));

        assertThatThrownBy(() -> new RetryInterceptor(0, 1).intercept(chain))
                .isInstanceOf(IOException.class)
                .hasMessage("unreachable");
    }

    @Test
    void testIsRetryable() {
        assertThat(RetryInterceptor.isRetryable(429)).isTrue();
        assertThat(RetryInterceptor.isRetryable(502)).isTrue();
        assertThat(RetryInterceptor.isRetryable(400)).isFalse();
        assertThat(RetryInterceptor.isRetryable(200)).isFalse();
    }

    private Response response(int code) {
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("status " + code)
                .body(ResponseBody.create("", MediaType.parse("application/json")))
                .build();
    }
}
