/**
 * A minimal HTTP/1.x server.<p>
 *
 * Start with {@link alpha.tinyhttp.HttpServer#create(alpha.tinyhttp.handler.ExceptionHandler...)}.
 */
package alpha.tinyhttp;
