package org.genesignature.tools.signature.consensus;

import org.genesignature.exceptions.GeneSignatureException;
import org.genesignature.utils.Utils;
import org.genesignature.utils.param.ParamUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link ExchangeStore} backed by a concurrent map, for runs that stay within one JVM.
 */
public final class InMemoryExchangeStore implements ExchangeStore {
    private static final long serialVersionUID = 1L;

    private final Map<ExchangeRole, Map<Integer, BootstrapSample>> samplesByRole = new ConcurrentHashMap<>();

    public InMemoryExchangeStore() {
        for (final ExchangeRole role : ExchangeRole.values()) {
            samplesByRole.put(role, new ConcurrentHashMap<>());
        }
    }

    @Override
    public void put(final int iteration, final ExchangeRole role, final BootstrapSample sample) {
        ParamUtils.isPositiveOrZero(iteration, "Iteration index must be non-negative.");
        Utils.nonNull(role);
        Utils.nonNull(sample);
        samplesByRole.get(role).put(iteration, sample);
    }

    @Override
    public List<Integer> listCompleted() {
        return samplesByRole.get(ExchangeRole.QUERY).keySet().stream().sorted().collect(Collectors.toList());
    }

    @Override
    public BootstrapSample get(final int iteration, final ExchangeRole role) {
        Utils.nonNull(role);
        final BootstrapSample sample = samplesByRole.get(role).get(iteration);
        if (sample == null) {
            throw new GeneSignatureException(String.format("No %s sample was stored for iteration %d.", role.getName(), iteration));
        }
        return sample;
    }
}
