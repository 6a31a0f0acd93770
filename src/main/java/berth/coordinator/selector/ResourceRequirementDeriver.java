package berth.coordinator.selector;

import berth.coordinator.model.ClusterMode;
import berth.coordinator.model.KernelWorkload;
import berth.coordinator.model.ResourceRequirements;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.SessionWorkload;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a session into the requirements the selector places one by one.
 *
 * Single-node kernels share one agent, so only their sum matters and they must
 * agree on architecture. Multi-node kernels are placed independently.
 */
public final class ResourceRequirementDeriver {

    private ResourceRequirementDeriver() {
    }

    /**
     * @return requirements in kernel order; empty for a session without kernels
     * @throws MixedArchitectureException if a single-node session mixes architectures
     */
    public static List<ResourceRequirements> derive(SessionWorkload session) {
        List<KernelWorkload> kernels = session.kernels();
        if (kernels.isEmpty()) {
            return List.of();
        }

        if (session.clusterMode() == ClusterMode.SINGLE_NODE) {
            Set<String> architectures = new LinkedHashSet<>();
            for (KernelWorkload kernel : kernels) {
                architectures.add(kernel.architecture());
            }
            if (architectures.size() > 1) {
                throw new MixedArchitectureException(session.id(), architectures);
            }

            ResourceSlot total = ResourceSlot.empty();
            List<String> kernelIds = new ArrayList<>(kernels.size());
            for (KernelWorkload kernel : kernels) {
                total = total.add(kernel.requestedSlots());
                kernelIds.add(kernel.kernelId());
            }
            return List.of(new ResourceRequirements(total, architectures.iterator().next(), kernelIds));
        }

        List<ResourceRequirements> requirements = new ArrayList<>(kernels.size());
        for (KernelWorkload kernel : kernels) {
            requirements.add(new ResourceRequirements(
                    kernel.requestedSlots(),
                    kernel.architecture(),
                    List.of(kernel.kernelId())));
        }
        return requirements;
    }
}
