package com.asiainfo.cube.core.engine;

import com.asiainfo.cube.config.CubeConfig;
import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.LoadException;
import com.asiainfo.cube.core.exception.NotGeneratedException;
import com.asiainfo.cube.core.exception.SchemaConflictException;
import com.asiainfo.cube.core.generator.AggregatePlan;
import com.asiainfo.cube.core.generator.AggregateSqlGenerator;
import com.asiainfo.cube.core.generator.EntriesSqlGenerator;
import com.asiainfo.cube.core.generator.ResultDecoder;
import com.asiainfo.cube.core.loader.EntryLoader;
import com.asiainfo.cube.core.model.AggregateRequest;
import com.asiainfo.cube.core.model.AggregateResult;
import com.asiainfo.cube.core.model.CompoundDimension;
import com.asiainfo.cube.core.model.DatasetInfo;
import com.asiainfo.cube.core.model.EntriesRequest;
import com.asiainfo.cube.core.model.Field;
import com.asiainfo.cube.core.parser.CubeModel;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.asiainfo.cube.core.schema.SchemaCompiler;
import com.asiainfo.cube.core.schema.TableDef;
import com.asiainfo.cube.infra.persistence.StorageExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 数据集 Cube
 * 生命周期：UNINITIALIZED -> init() -> INITIALIZED -> generate() -> GENERATED，drop() 回到 INITIALIZED
 */
public class Cube {

    private static final Logger log = LoggerFactory.getLogger(Cube.class);

    public enum State {
        UNINITIALIZED,
        INITIALIZED,
        GENERATED
    }

    private final CubeModel model;
    private final SchemaCompiler compiler;
    private final StorageExecutor executor;
    private final CubeConfig config;
    private final ObjectMapper mapper;
    private final Counter loadedCounter;
    private final Counter failedCounter;

    private volatile State state = State.UNINITIALIZED;
    private PhysicalSchema schema;
    private EntryLoader loader;
    private AggregateSqlGenerator aggregateGenerator;
    private EntriesSqlGenerator entriesGenerator;

    public Cube(CubeModel model, SchemaCompiler compiler, StorageExecutor executor,
                CubeConfig config, ObjectMapper mapper, MeterRegistry registry) {
        this.model = model;
        this.compiler = compiler;
        this.executor = executor;
        this.config = config;
        this.mapper = mapper;
        this.loadedCounter = Counter.builder("cube.load.entries")
                .description("Entries loaded into the cube")
                .tag("dataset", model.name())
                .register(registry);
        this.failedCounter = Counter.builder("cube.load.failures")
                .description("Entries rejected while loading")
                .tag("dataset", model.name())
                .register(registry);
    }

    /**
     * 绑定物理 schema（可重复调用，只编译一次）；若事实表已存在则直接进入 GENERATED
     */
    public synchronized Cube init() {
        if (schema == null) {
            schema = compiler.compile(model.info(), model.fields());
            loader = new EntryLoader(model.fields(), schema, executor);
            aggregateGenerator = new AggregateSqlGenerator(model.fields(), schema, config.getMaxPagesize());
            entriesGenerator = new EntriesSqlGenerator(model.fields(), schema);
        }
        state = executor.tableExists(schema.factTable().name()) ? State.GENERATED : State.INITIALIZED;
        log.info("Cube {} initialized, state={}", key(), state);
        return this;
    }

    /**
     * 创建物理表：事实表已存在且结构一致时为空操作，结构不一致抛 SchemaConflictException
     */
    public synchronized void generate() {
        ensureInitialized();
        boolean factExists = executor.tableExists(schema.factTable().name());
        for (TableDef table : schema.allTables()) {
            Set<String> actual = executor.columnsOf(table.name());
            if (actual.isEmpty() && !factExists) {
                continue;
            }
            Set<String> expected = table.columnNames().stream()
                    .map(c -> c.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            if (!expected.equals(actual)) {
                throw new SchemaConflictException(table.name(), expected, actual);
            }
        }
        if (factExists) {
            log.info("Cube {} already generated", key());
        } else {
            executor.executeAll(schema.createStatements());
            log.info("Cube {} generated: {} tables", key(), schema.allTables().size());
        }
        state = State.GENERATED;
    }

    /**
     * 删除物理表（事实表优先），表不存在时忽略
     */
    public synchronized void drop() {
        ensureInitialized();
        executor.executeAll(schema.dropStatements());
        state = State.INITIALIZED;
        log.info("Cube {} dropped", key());
    }

    /**
     * 清空数据，保留表结构
     */
    public void flush() {
        requireGenerated("flush");
        executor.executeAll(schema.flushStatements());
        log.info("Cube {} flushed", key());
    }

    /**
     * 装载一条反范式记录
     *
     * @return 事实行标识
     */
    public String load(Map<String, ?> entry) {
        requireGenerated("load");
        try {
            String id = loader.load(entry);
            loadedCounter.increment();
            return id;
        } catch (LoadException e) {
            failedCounter.increment();
            throw e;
        }
    }

    /**
     * 批量装载：逐条提交，单条失败记录到结果中，不中断整批
     */
    public LoadResult loadAll(Iterable<? extends Map<String, ?>> entries) {
        requireGenerated("load");
        int loaded = 0;
        int index = 0;
        List<String> errors = new ArrayList<>();
        for (Map<String, ?> entry : entries) {
            try {
                load(entry);
                loaded++;
            } catch (LoadException e) {
                log.warn("Cube {}: entry #{} rejected on field {}: {}", key(), index, e.getField(), e.getMessage());
                errors.add("#" + index + ": " + e.getMessage());
            }
            index++;
        }
        log.info("Cube {} batch load finished: loaded={}, failed={}", key(), loaded, errors.size());
        return new LoadResult(loaded, errors.size(), errors);
    }

    public AggregateResult aggregate(AggregateRequest request) {
        requireGenerated("aggregate");
        if (request.pagesize() == null) {
            request = request.withPagesize(Math.min(config.getDefaultPagesize(), config.getMaxPagesize()));
        }
        long start = System.currentTimeMillis();

        // 编译阶段完成所有校验，之后才执行
        AggregatePlan plan = aggregateGenerator.compile(request);

        Map<String, Object> totals = executor.query(plan.summary()).get(0);
        Map<String, Object> summaryRow = ResultDecoder.decodeTotals(totals, plan);
        long numDrilldowns = 1;
        if (plan.hasGroups()) {
            List<Map<String, Object>> countRows = executor.query(plan.drilldownCount());
            numDrilldowns = countRows.isEmpty() ? 0
                    : ((Number) countRows.get(0).get(AggregateSqlGenerator.NUM_DRILLDOWNS_ALIAS)).longValue();
        }
        List<Map<String, Object>> drilldown = new ArrayList<>();
        for (Map<String, Object> row : executor.query(plan.drilldown())) {
            drilldown.add(ResultDecoder.decodeAggregate(row, plan));
        }

        int pages = (int) Math.ceil(numDrilldowns / (double) plan.pagesize());
        AggregateResult.Summary summary = new AggregateResult.Summary(
                plan.measure(),
                (Double) summaryRow.get(plan.measure()),
                (Long) summaryRow.get(CubeConstants.NUM_ENTRIES),
                model.info().currency(),
                numDrilldowns,
                plan.page(),
                pages,
                plan.pagesize());

        log.debug("Cube {} aggregate {} by {}: {} rows in {} ms", key(), plan.measure(),
                request.drilldowns(), drilldown.size(), System.currentTimeMillis() - start);
        return new AggregateResult(drilldown, summary);
    }

    /**
     * 明细查询：惰性、可重复迭代，每次 iterator() 重新扫描
     */
    public Iterable<Map<String, Object>> entries(EntriesRequest request) {
        requireGenerated("read entries");
        EntriesSqlGenerator.EntriesPlan plan = entriesGenerator.compile(request);
        return () -> new EntryIterator(plan, config.getEntriesBatchSize());
    }

    public Iterable<Map<String, Object>> entries() {
        return entries(EntriesRequest.all());
    }

    /**
     * 事实行数；未生成时为 0
     */
    public long count() {
        if (!isGenerated()) {
            return 0;
        }
        List<Map<String, Object>> rows = executor.query(entriesGenerator.count());
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get(CubeConstants.NUM_ENTRIES)).longValue();
    }

    public boolean isGenerated() {
        return state == State.GENERATED;
    }

    public State state() {
        return state;
    }

    public String key() {
        return model.name();
    }

    public List<Field> fields() {
        return model.fields().fields();
    }

    public List<CompoundDimension> compounds() {
        return model.fields().compounds();
    }

    public List<Field> facetDimensions() {
        return model.fields().facetDimensions();
    }

    public DatasetInfo info() {
        return model.info();
    }

    public PhysicalSchema schema() {
        ensureInitialized();
        return schema;
    }

    /**
     * 模型描述（dataset 段按解析结果重新渲染）
     */
    public JsonNode model() {
        ObjectNode description = model.description().deepCopy();
        description.set("dataset", mapper.valueToTree(model.info().asMap()));
        return description;
    }

    private void ensureInitialized() {
        if (schema == null) {
            init();
        }
    }

    private void requireGenerated(String operation) {
        if (state != State.GENERATED) {
            throw new NotGeneratedException(key(), operation);
        }
    }

    /**
     * 按 id 顺序分批拉取
     */
    private class EntryIterator implements Iterator<Map<String, Object>> {

        private final EntriesSqlGenerator.EntriesPlan plan;
        private final int batchSize;
        private List<Map<String, Object>> batch = List.of();
        private int position;
        private int fetched;
        private boolean exhausted;

        EntryIterator(EntriesSqlGenerator.EntriesPlan plan, int batchSize) {
            this.plan = plan;
            this.batchSize = batchSize;
        }

        @Override
        public boolean hasNext() {
            if (position < batch.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            int size = batchSize;
            if (plan.limit() != null) {
                size = Math.min(size, plan.limit() - fetched);
            }
            if (size <= 0) {
                exhausted = true;
                return false;
            }
            batch = executor.query(plan.batch(plan.offset() + fetched, size));
            position = 0;
            fetched += batch.size();
            if (batch.size() < size) {
                exhausted = true;
            }
            return !batch.isEmpty();
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ResultDecoder.decodeEntry(batch.get(position++), plan.outputs());
        }
    }
}
