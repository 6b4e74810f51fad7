package com.techStack.courseHub.util.firebase;

import com.google.api.core.ApiFuture;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

public final class FirestoreUtil {

    private FirestoreUtil() {
    }

    /**
     * Converts a Google Cloud ApiFuture to a CompletableFuture.
     *
     * @param apiFuture the ApiFuture to convert
     * @param <T>       the type of the future's result
     * @return a CompletableFuture representing the result of the ApiFuture
     */
    public static <T> CompletableFuture<T> toCompletableFuture(ApiFuture<T> apiFuture) {
        CompletableFuture<T> completableFuture = new CompletableFuture<>();

        apiFuture.addListener(() -> {
            try {
                completableFuture.complete(apiFuture.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                completableFuture.completeExceptionally(e);
            } catch (ExecutionException e) {
                completableFuture.completeExceptionally(e.getCause());
            }
        }, Runnable::run);

        return completableFuture;
    }
}
