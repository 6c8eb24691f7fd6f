package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.dto.PreviewColumnDto;
import teranet.mapdev.forge.dto.PreviewDto;
import teranet.mapdev.forge.model.DatasetSample;
import teranet.mapdev.forge.model.TransformSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a normalized transform over in-memory samples.
 *
 * Order: join, filter, computed columns, sort, limit, projection, output cap.
 * The samples passed in are not modified.
 */
@Service
@Slf4j
public class TransformPreviewService {

    private final JoinEngine joinEngine;
    private final FilterEvaluator filterEvaluator;
    private final ComputedColumnDeriver computedColumnDeriver;
    private final OutputProjector outputProjector;

    public TransformPreviewService(JoinEngine joinEngine,
            FilterEvaluator filterEvaluator,
            ComputedColumnDeriver computedColumnDeriver,
            OutputProjector outputProjector) {
        this.joinEngine = joinEngine;
        this.filterEvaluator = filterEvaluator;
        this.computedColumnDeriver = computedColumnDeriver;
        this.outputProjector = outputProjector;
    }

    /**
     * @param primary      primary dataset sample
     * @param rights       right-hand samples by dataset tag
     * @param transform    normalized transform
     * @param defaultLimit limit used when the transform sets none (the primary row cap)
     * @param outputRows   number of rows returned
     * @return projected rows and their columns
     */
    public PreviewDto preview(DatasetSample primary,
            Map<String, DatasetSample> rights,
            TransformSpec transform,
            int defaultLimit,
            int outputRows) {
        List<Map<String, String>> rows = new ArrayList<>(primary.getRows().size());
        for (Map<String, String> row : primary.getRows()) {
            rows.add(new LinkedHashMap<>(row));
        }

        Map<String, List<Map<String, String>>> rightRows = new LinkedHashMap<>();
        rights.forEach((tag, sample) -> rightRows.put(tag, sample.getRows()));

        rows = joinEngine.execute(rows, rightRows, transform.getJoins());
        rows = filterEvaluator.apply(rows, transform.getFilterGroups());
        computedColumnDeriver.derive(rows, transform.getComputedColumns());
        rows = outputProjector.sort(rows, transform.getSort());
        rows = outputProjector.limit(rows, transform.getLimit(), defaultLimit);

        List<PreviewColumnDto> columns = outputProjector.selectColumns(transform);
        PreviewDto preview = outputProjector.project(rows, columns, outputRows);
        log.debug("Preview produced {} row(s) and {} column(s) from {} primary row(s)",
                preview.getRows().size(), preview.getColumns().size(), primary.getRows().size());
        return preview;
    }
}
