package com.federation.application.port.in;

import com.federation.domain.error.IndexWriteError;
import com.federation.domain.model.FederationIndexEntry;
import com.federation.domain.model.Result;

public interface WriteFederationIndexUseCase {
    Result<FederationIndexEntry, IndexWriteError> insert(FederationIndexEntry entry, String actorKey);
    Result<Void, IndexWriteError> remove(String entryId, String actorKey);
}
