/**
 * The HTTP message model: {@link alpha.tinyhttp.message.Request},
 * {@link alpha.tinyhttp.message.Response} and the exceptions used to reject a
 * request.
 */
package alpha.tinyhttp.message;
