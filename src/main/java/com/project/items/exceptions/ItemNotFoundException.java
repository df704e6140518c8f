package com.project.items.exceptions;

public class ItemNotFoundException extends RuntimeException {
    private final long itemId;

    public ItemNotFoundException(long itemId) {
        super("Item not found");
        this.itemId = itemId;
    }

    public long getItemId() { return itemId; }
}
