/**
 * Home of the library-provided server implementation.<p>
 *
 * The only public types in this package are
 * {@link alpha.tinyhttp.core.DefaultServer} and
 * {@link alpha.tinyhttp.core.DefaultServerFactory}, the latter loaded by
 * {@link alpha.tinyhttp.HttpServer#create(alpha.tinyhttp.handler.ExceptionHandler...)}.
 * All other types in this package can be regarded as an implementation
 * detail.<p>
 *
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.tinyhttp.core;
