package com.apiserver.rest;

import com.apiserver.hal.Entity;
import com.apiserver.hal.EntityCollection;
import com.apiserver.resource.Capabilities;
import com.apiserver.validation.FilterResult;
import com.apiserver.validation.InputFilter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resource supporting every operation, recording the last call it received.
 */
public class TestWidgetResource implements
        Capabilities.Fetch<TestWidgetResource.Widget>,
        Capabilities.FetchAll<TestWidgetResource.Widgets>,
        Capabilities.Create<TestWidgetResource.Widget>,
        Capabilities.Update<TestWidgetResource.Widget>,
        Capabilities.UpdateList<TestWidgetResource.Widgets>,
        Capabilities.Patch<TestWidgetResource.Widget>,
        Capabilities.PatchList<TestWidgetResource.Widgets>,
        Capabilities.Delete,
        Capabilities.DeleteList,
        Capabilities.Head,
        Capabilities.Options {

    /** Requires a name unless validating a group; assigns a default status. */
    static final InputFilter NAME_REQUIRED = (data, group) -> {
        Object name = data.get("name");
        boolean checkName = group == null || group.contains("name");
        if (checkName && (!(name instanceof String) || ((String) name).isBlank())) {
            return FilterResult.invalid(Map.of("name", List.of("Name is required")));
        }
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", name);
        values.put("status", data.getOrDefault("status", "draft"));
        return FilterResult.valid(values);
    };

    private String lastOperation;
    private String lastId;
    private Map<String, Object> lastData;
    private final List<Widget> widgets = List.of(
        new Widget("1", "one"), new Widget("2", "two"), new Widget("3", "three"));

    @Override
    public String resourceName() {
        return "widgets";
    }

    @Override
    public Optional<InputFilter> inputFilter() {
        return Optional.of(NAME_REQUIRED);
    }

    @Override
    public Widget fetch(String id) {
        remember("fetch", id, null);
        return new Widget(id, "fetched");
    }

    @Override
    public Widgets fetchAll() {
        remember("fetchAll", null, null);
        return new Widgets(widgets);
    }

    @Override
    public Widget create(Map<String, Object> data) {
        remember("create", null, data);
        return new Widget("99", String.valueOf(data.get("name")));
    }

    @Override
    public Widget update(String id, Map<String, Object> data) {
        remember("update", id, data);
        return new Widget(id, String.valueOf(data.get("name")));
    }

    @Override
    public Widgets updateList(Map<String, Object> data) {
        remember("updateList", null, data);
        return new Widgets(widgets);
    }

    @Override
    public Widget patch(String id, Map<String, Object> data) {
        remember("patch", id, data);
        return new Widget(id, "patched");
    }

    @Override
    public Widgets patchList(Map<String, Object> data) {
        remember("patchList", null, data);
        return new Widgets(widgets);
    }

    @Override
    public void delete(String id) {
        remember("delete", id, null);
    }

    @Override
    public void deleteList() {
        remember("deleteList", null, null);
    }

    @Override
    public ApiResponse head() {
        remember("head", null, null);
        return ApiResponse.empty(200);
    }

    @Override
    public ApiResponse options() {
        remember("options", null, null);
        return ApiResponse.empty(204).withHeader("Allow", "GET, POST");
    }

    private void remember(String operation, String id, Map<String, Object> data) {
        this.lastOperation = operation;
        this.lastId = id;
        this.lastData = data;
    }

    public String getLastOperation() {
        return lastOperation;
    }

    public String getLastId() {
        return lastId;
    }

    public Map<String, Object> getLastData() {
        return lastData;
    }

    public static class Widget implements Entity {
        private final String id;
        private final String name;

        public Widget(String id, String name) {
            this.id = id;
            this.name = name;
        }

        @Override
        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }
    }

    public static class Widgets extends EntityCollection<Widget> {
        public Widgets(List<Widget> widgets) {
            super(widgets);
        }
    }
}
