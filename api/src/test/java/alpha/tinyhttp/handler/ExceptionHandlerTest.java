package alpha.tinyhttp.handler;

import alpha.tinyhttp.message.MalformedRequestException;
import alpha.tinyhttp.message.MaxRequestSizeException;
import alpha.tinyhttp.message.Response;
import alpha.tinyhttp.message.Responses;
import org.junit.jupiter.api.Test;

import java.io.Serial;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link ExceptionHandler#BASE}.<p>
 *
 * The base handler does not contain much logic; the chain is tested in
 * medium-sized tests.
 */
final class ExceptionHandlerTest {
    @Test
    void hasResponse_isReturned() throws Exception {
        class Teapot extends RuntimeException implements HasResponse {
            @Serial private static final long serialVersionUID = 1L;
            @Override public Response getResponse() {
                return new Response().setStatus(418, "I'm a teapot");
            }
        }
        var actual = ExceptionHandler.BASE.apply(new Teapot(), null, null);
        assertThat(actual.statusCode()).isEqualTo(418);
    }

    @Test
    void malformed_is400() throws Exception {
        var actual = ExceptionHandler.BASE.apply(
                new MalformedRequestException("x", 0), null, null);
        assertThat(actual.statusCode()).isEqualTo(400);
    }

    @Test
    void tooLarge_is413() throws Exception {
        var actual = ExceptionHandler.BASE.apply(
                new MaxRequestSizeException(1, 2), null, null);
        assertThat(actual.statusCode()).isEqualTo(413);
    }

    @Test
    void other_is500() throws Exception {
        var actual = ExceptionHandler.BASE.apply(
                new IllegalStateException("oops"), null, null);
        assertThat(actual.statusCode()).isEqualTo(500);
        assertThat(actual.body()).isEqualTo(Responses.internalServerError().body());
    }
}
