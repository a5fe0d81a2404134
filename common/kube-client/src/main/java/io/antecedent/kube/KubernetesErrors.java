package io.antecedent.kube;

import io.antecedent.ownership.ports.BackendException;
import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * Translates fabric8 client failures into {@link BackendException}, keeping the HTTP code,
 * the API status reason and any suggested retry delay so they can be classified later.
 */
final class KubernetesErrors {

    private KubernetesErrors() {
    }

    static BackendException translate(String action, RuntimeException e) {
        if (e instanceof BackendException backend) {
            return backend;
        }
        if (e instanceof KubernetesClientException kube) {
            Status status = kube.getStatus();
            String reason = status == null ? null : status.getReason();
            StatusDetails details = status == null ? null : status.getDetails();
            Integer retryAfter = details == null ? null : details.getRetryAfterSeconds();
            int code = kube.getCode() > 0 ? kube.getCode() : codeOf(status);
            return new BackendException(code, reason, retryAfter, "Unable to " + action + ": " + kube.getMessage(), kube);
        }
        return new BackendException(BackendException.NO_RESPONSE, null, null,
            "Unable to " + action + ": " + e.getMessage(), e);
    }

    private static int codeOf(Status status) {
        if (status == null || status.getCode() == null) {
            return BackendException.NO_RESPONSE;
        }
        return status.getCode();
    }
}
