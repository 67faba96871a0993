/**
 * Turns evaluated-mode command results into local values with live proxy handles.
 *
 * <p>The engine describes objects with debug strings such as
 * {@code Class: ENS_PART, desc: 'Sphere', CvfObjID: 1078, cached:no}, embedded anywhere in
 * the Python representation of a result. {@link io.ensightrpc.client.proxy.ReprScanner}
 * splits a result into literal spans and object references,
 * {@link io.ensightrpc.client.proxy.ResultMarshaller} resolves each reference against the
 * session's {@link io.ensightrpc.client.proxy.ProxyCache}, and
 * {@link io.ensightrpc.client.proxy.ReprParser} rebuilds Java values around them.
 */
package io.ensightrpc.client.proxy;
