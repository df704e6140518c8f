package com.project.items.controller;

import com.project.items.DTOs.ItemCreateRequest;
import com.project.items.DTOs.ItemResponse;
import com.project.items.service.ItemService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/items")
@Validated
public class ItemController {

    private final ItemService itemService;

    public ItemController(ItemService itemService) {
        this.itemService = itemService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ItemResponse create(@Valid @RequestBody ItemCreateRequest request) {
        return ItemResponse.from(itemService.create(request.name(), request.description()));
    }

    @GetMapping
    public List<ItemResponse> list(
            @RequestParam(name = "skip", defaultValue = "0")
            @Min(value = 0, message = "skip must not be negative") int skip,
            @RequestParam(name = "limit", defaultValue = "100")
            @Min(value = 0, message = "limit must not be negative") int limit
    ) {
        return itemService.list(skip, limit).stream()
                .map(ItemResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ItemResponse get(@PathVariable("id") long id) {
        return ItemResponse.from(itemService.get(id));
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable("id") long id) {
        itemService.delete(id);
        return Map.of("message", "Item deleted successfully");
    }
}
