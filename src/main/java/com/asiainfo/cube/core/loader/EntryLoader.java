package com.asiainfo.cube.core.loader;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.LoadException;
import com.asiainfo.cube.core.model.Field;
import com.asiainfo.cube.core.model.FieldModel;
import com.asiainfo.cube.core.model.SqlRequest;
import com.asiainfo.cube.core.schema.ColumnDef;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.asiainfo.cube.infra.persistence.StorageExecutor;
import com.asiainfo.cube.infra.persistence.StorageSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.asiainfo.cube.core.model.SqlNames.quote;

/**
 * 事实数据装载
 * 单条反范式记录 -> 维度成员 upsert + 事实行 upsert，整条记录在一个事务中完成
 */
public class EntryLoader {

    private static final Logger log = LoggerFactory.getLogger(EntryLoader.class);

    private final FieldModel model;
    private final PhysicalSchema schema;
    private final StorageExecutor executor;

    public EntryLoader(FieldModel model, PhysicalSchema schema, StorageExecutor executor) {
        this.model = model;
        this.schema = schema;
        this.executor = executor;
    }

    /**
     * @return 事实行标识（整条原始记录的内容哈希）
     */
    public String load(Map<String, ?> raw) {
        if (raw == null) {
            throw new LoadException(null, "Entry is null");
        }
        return executor.inTransaction(session -> loadInSession(session, raw));
    }

    private String loadInSession(StorageSession session, Map<String, ?> raw) {
        Map<String, Object> entry = new LinkedHashMap<>();
        for (Field field : model.fields()) {
            if (!raw.containsKey(field.name())) {
                throw LoadException.missingField(field.name());
            }
            entry.putAll(field.load(session, raw.get(field.name())));
        }
        String id = ContentHasher.hash(raw);
        entry.put(CubeConstants.ID_COLUMN, id);
        session.update(upsertRequest(entry));
        log.debug("Loaded entry {} into {}", id, schema.factTable().name());
        return id;
    }

    /**
     * INSERT ... ON CONFLICT(id) DO UPDATE：相同标识重复装载时原地更新
     */
    SqlRequest upsertRequest(Map<String, Object> entry) {
        List<String> columns = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        List<String> updates = new ArrayList<>();
        for (ColumnDef column : schema.factTable().columns()) {
            columns.add(quote(column.name()));
            params.add(entry.get(column.name()));
            if (!column.primaryKey()) {
                updates.add(quote(column.name()) + " = excluded." + quote(column.name()));
            }
        }
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String onConflict = updates.isEmpty()
                ? "DO NOTHING"
                : "DO UPDATE SET " + String.join(", ", updates);
        String sql = String.format("INSERT INTO %s (%s) VALUES (%s) ON CONFLICT (%s) %s",
                quote(schema.factTable().name()), String.join(", ", columns), placeholders,
                quote(CubeConstants.ID_COLUMN), onConflict);
        return new SqlRequest(sql, params);
    }
}
