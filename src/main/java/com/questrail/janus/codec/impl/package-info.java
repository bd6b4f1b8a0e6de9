/**
 * Jackson-backed implementations of the Janus wire codecs.
 *
 * <ul>
 *   <li>{@link com.questrail.janus.codec.impl.JacksonEnvelopeCodec}: one envelope per datagram</li>
 *   <li>{@link com.questrail.janus.codec.impl.LengthPrefixedFraming}: 4-byte big-endian length
 *       prefix for the stream fallback transport</li>
 * </ul>
 */
package com.questrail.janus.codec.impl;
