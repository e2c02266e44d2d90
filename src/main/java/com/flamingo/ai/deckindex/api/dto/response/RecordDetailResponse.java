package com.flamingo.ai.deckindex.api.dto.response;

import java.util.List;

/** A ledger record with its audit trail. */
public record RecordDetailResponse(
    ProcessingRecordResponse record, List<ProcessingEventResponse> events) {}
