/**
 * Vendor adapters.
 *
 * <p>Each sub-package holds one vendor: typed wire records, a stream dialect and the adapter
 * itself. Adapters share no mutable base class; common helpers live in
 * {@link fr.lapetina.airouter.provider.AdapterSupport} and
 * {@link fr.lapetina.airouter.provider.ProviderJson}.
 *
 * @see fr.lapetina.airouter.provider.ProviderAdapter
 * @see fr.lapetina.airouter.provider.ProviderAdapterFactory
 */
package fr.lapetina.airouter.provider;
