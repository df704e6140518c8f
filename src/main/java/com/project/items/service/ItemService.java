package com.project.items.service;

import com.project.items.exceptions.ItemNotFoundException;
import com.project.items.exceptions.ItemOperationException;
import com.project.items.exceptions.PersistenceException;
import com.project.items.model.Item;
import com.project.items.persistence.SessionFactory;
import com.project.items.persistence.SessionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Item operations. Each call runs exactly one session; store failures are logged here
 * with their cause and surface as {@link ItemOperationException} carrying only a generic message.
 */
@Service
public class ItemService {
    private static final Logger log = LoggerFactory.getLogger(ItemService.class);

    // limit is not capped; pages above this size are still served but logged as a resource risk
    static final int LARGE_PAGE_THRESHOLD = 1000;

    private final SessionFactory sessions;

    public ItemService(SessionFactory sessions) {
        this.sessions = sessions;
    }

    public Item create(String name, String description) {
        Item item = run("Failed to create item", session -> session.insert(name, description));
        log.info("Created item with id: {}", item.id());
        return item;
    }

    public List<Item> list(int skip, int limit) {
        if (limit > LARGE_PAGE_THRESHOLD) {
            log.warn("Unbounded page requested: skip={}, limit={}", skip, limit);
        }
        return run("Failed to fetch items", session -> session.findAll(skip, limit));
    }

    public Item get(long id) {
        return run("Failed to fetch item", session -> session.findById(id))
                .orElseThrow(() -> new ItemNotFoundException(id));
    }

    public void delete(long id) {
        boolean deleted = run("Failed to delete item", session -> session.delete(id));
        if (!deleted) {
            throw new ItemNotFoundException(id);
        }
        log.info("Deleted item with id: {}", id);
    }

    private <T> T run(String failure, SessionWork<T> work) {
        try {
            return sessions.inSession(work);
        } catch (PersistenceException e) {
            log.error("{}: {}", failure, e.getMessage(), e);
            throw new ItemOperationException(failure, e);
        }
    }
}
