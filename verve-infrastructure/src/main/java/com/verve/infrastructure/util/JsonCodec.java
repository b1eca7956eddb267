package com.verve.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verve.domain.epic.model.valobj.ProposedTask;
import com.verve.types.enums.ResponseCode;
import com.verve.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JSONB 列表列编解码：depends_on、labels、proposed_tasks 等。
 * 空列与 null 一律按空数组处理，写出时从不返回 null。
 *
 * @author verve
 * @since 2025-06-02
 */
@Component
public class JsonCodec {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {};
    private static final TypeReference<List<ProposedTask>> PROPOSED_TASKS = new TypeReference<List<ProposedTask>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> readStringList(String column) {
        return readList(column, STRING_LIST);
    }

    public List<ProposedTask> readProposedTasks(String column) {
        return readList(column, PROPOSED_TASKS);
    }

    public String writeList(List<?> items) {
        try {
            return objectMapper.writeValueAsString(items == null ? List.of() : items);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to encode jsonb list column", ex);
        }
    }

    private <T> List<T> readList(String column, TypeReference<List<T>> type) {
        if (StringUtils.isBlank(column)) {
            return new ArrayList<>();
        }
        try {
            List<T> items = objectMapper.readValue(column, type);
            return items == null ? new ArrayList<>() : items;
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to decode jsonb list column", ex);
        }
    }
}
