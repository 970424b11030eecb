package alpha.tinyhttp.core;

import alpha.tinyhttp.message.Response;

import java.util.Map;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Serializes a response into bytes.<p>
 *
 * The status line and headers are encoded using ISO-8859-1, in the order the
 * headers were set, followed by an empty line and the body as is. The
 * response is not validated; what the application set is what gets sent.
 */
final class ResponseSerializer
{
    private static final String SP = " ", CRLF = "\r\n", COLON = ": ";

    private ResponseSerializer() {
        // Empty
    }

    /**
     * Serializes a response.
     *
     * @param rsp response
     * @return the bytes
     */
    static byte[] serialize(Response rsp) {
        var head = new StringBuilder()
                .append(rsp.version()).append(SP)
                .append(rsp.statusCode()).append(SP)
                .append(rsp.statusMessage()).append(CRLF);
        for (Map.Entry<String, String> h : rsp.headers().entrySet()) {
            head.append(h.getKey()).append(COLON).append(h.getValue()).append(CRLF);
        }
        head.append(CRLF);

        byte[] h = head.toString().getBytes(ISO_8859_1),
               b = rsp.body(),
               all = new byte[h.length + b.length];
        System.arraycopy(h, 0, all, 0, h.length);
        System.arraycopy(b, 0, all, h.length, b.length);
        return all;
    }
}
