/**
 * Pull-based completion streams and vendor framing.
 */
package fr.lapetina.airouter.streaming;
