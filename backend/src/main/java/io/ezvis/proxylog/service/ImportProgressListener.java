package io.ezvis.proxylog.service;

import io.ezvis.proxylog.service.dto.ImportProgress;

@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NONE = progress -> { };

    void onProgress(ImportProgress progress);
}
