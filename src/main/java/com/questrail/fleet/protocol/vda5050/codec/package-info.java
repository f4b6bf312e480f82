/**
 * VDA5050 Codec
 * =============================================================================
 *
 * <p>Wire-level handling of VDA5050 traffic: topic names, JSON payloads and
 * header sequencing. Everything in this package is pure with respect to the
 * network; it never touches the broker session.</p>
 *
 * <pre>
 *   (topic, byte[])
 *        → Vda5050TopicCodec        (interface / manufacturer / serial / segment)
 *            → Vda5050MessageDecoder (JSON → validated semantic message)
 *                → HeaderSequenceGuard (drop replays, honour resync)
 *                    → telemetry / acknowledgement matching
 * </pre>
 *
 * <p>Outbound, {@link com.questrail.fleet.protocol.vda5050.codec.Vda5050MessageEncoder}
 * assigns headerIds and orderUpdateIds and produces topic plus payload; the
 * connection manager only ever sees the resulting bytes.</p>
 */
package com.questrail.fleet.protocol.vda5050.codec;
