package com.datasheetrag.store;

public record CollectionStats(long totalRecords, String collectionName, String storageLocation) {
}
