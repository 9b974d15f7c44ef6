/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

import io.prometheus.client.Collector;
import io.tagstats.api.tag.Tag;
import io.tagstats.api.tag.TagKey;
import io.tagstats.sdk.stats.AggregationType;
import io.tagstats.sdk.stats.Row;
import io.tagstats.sdk.stats.View;
import io.tagstats.sdk.stats.ViewData;
import io.tagstats.sdk.stats.ViewDataProducer;
import io.tagstats.sdk.stats.data.AggregationData;
import io.tagstats.sdk.stats.data.CountData;
import io.tagstats.sdk.stats.data.DistributionData;
import io.tagstats.sdk.stats.data.LastValueData;
import io.tagstats.sdk.stats.data.SumData;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A Prometheus {@link Collector} that renders a fresh snapshot of every registered view on each
 * collection.
 *
 * <p>Labels of a row are its tags, overridden by the constant labels, overridden by the resource
 * labels. Distribution rows become histograms whose bucket counts are cumulative.
 *
 * <p>Collection fails with an {@link IllegalStateException} when two views render to the same
 * metric name with a different type, help or label names, to the same series, or to metrics whose
 * sample names overlap (a count {@code x} and a sum {@code x_total}). A distribution whose labels
 * include {@code le} fails too.
 */
final class PrometheusStatsCollector extends Collector implements Collector.Describable {

  static final String LE_LABEL = "le";
  static final String BUCKET_SUFFIX = "_bucket";
  static final String COUNT_SUFFIX = "_count";
  static final String SUM_SUFFIX = "_sum";
  static final String TOTAL_SUFFIX = "_total";

  private final ViewDataProducer viewDataProducer;
  private final String namespace;
  private final Map<String, String> constLabels;
  private final Map<String, String> resourceLabels;

  // Keyed by metric name and label names.
  private final ConcurrentHashMap<String, SeriesDescriptor> descriptors =
      new ConcurrentHashMap<>();

  PrometheusStatsCollector(
      ViewDataProducer viewDataProducer,
      String namespace,
      Map<String, String> constLabels,
      Map<String, String> resourceLabels) {
    this.viewDataProducer = viewDataProducer;
    this.namespace = namespace;
    this.constLabels = sanitizeKeys(constLabels);
    this.resourceLabels = sanitizeKeys(resourceLabels);
  }

  /**
   * Views come and go after the collector is registered, so nothing is described up front and
   * the registry does not reserve names for this collector.
   */
  @Override
  public List<MetricFamilySamples> describe() {
    return Collections.emptyList();
  }

  @Override
  public List<MetricFamilySamples> collect() {
    Map<String, Family> families = new TreeMap<>();
    Map<String, String> familiesBySampleName = new HashMap<>();
    for (ViewData viewData : viewDataProducer.collectAll()) {
      View view = viewData.getView();
      SeriesDescriptor descriptor = getDescriptor(view);
      Type type = toType(view.getAggregation().getType());
      Family family = families.get(descriptor.getName());
      if (family == null) {
        if (type == Type.HISTOGRAM && descriptor.getLabelNames().contains(LE_LABEL)) {
          throw new IllegalStateException(
              "collected histogram \"" + descriptor.getName() + "\" has a label named \""
                  + LE_LABEL + "\", which is reserved for bucket bounds");
        }
        for (String sampleName : sampleNames(descriptor.getName(), type)) {
          String owner = familiesBySampleName.putIfAbsent(sampleName, descriptor.getName());
          if (owner != null) {
            throw new IllegalStateException(
                "collected metric \"" + descriptor.getName() + "\" has sample name \""
                    + sampleName + "\", which is also used by collected metric \"" + owner
                    + "\"");
          }
        }
        family = new Family(descriptor, type);
        families.put(descriptor.getName(), family);
      } else if (!family.descriptor.equals(descriptor) || family.type != type) {
        throw new IllegalStateException(
            "collected metric \"" + descriptor.getName()
                + "\" has a different type, help or label names than a previously collected"
                + " metric with the same name");
      }
      for (LabeledRow row : labelRows(descriptor, viewData.getRows())) {
        family.add(row);
      }
    }
    List<MetricFamilySamples> result = new ArrayList<>(families.size());
    for (Family family : families.values()) {
      result.add(family.toMetricFamilySamples());
    }
    return result;
  }

  // Visible for testing
  int getDescriptorCount() {
    return descriptors.size();
  }

  private SeriesDescriptor getDescriptor(View view) {
    String name = metricName(view);
    Set<String> labelNames = new TreeSet<>();
    for (TagKey key : view.getTagKeys()) {
      labelNames.add(NameSanitizer.sanitize(key.getName()));
    }
    labelNames.addAll(constLabels.keySet());
    labelNames.addAll(resourceLabels.keySet());
    List<String> sortedLabelNames = Collections.unmodifiableList(new ArrayList<>(labelNames));
    return descriptors.computeIfAbsent(
        name + sortedLabelNames,
        unused -> SeriesDescriptor.create(name, view.getDescription(), sortedLabelNames));
  }

  private String metricName(View view) {
    String name = namespace.isEmpty() ? view.getName() : namespace + "_" + view.getName();
    name = NameSanitizer.sanitize(name);
    if (view.getAggregation().getType() == AggregationType.COUNT && name.endsWith(TOTAL_SUFFIX)) {
      name = name.substring(0, name.length() - TOTAL_SUFFIX.length());
    }
    return name;
  }

  private List<LabeledRow> labelRows(SeriesDescriptor descriptor, List<Row> rows) {
    List<LabeledRow> labeled = new ArrayList<>(rows.size());
    for (Row row : rows) {
      Map<String, String> labels = new TreeMap<>();
      for (Tag tag : row.getTags()) {
        labels.put(NameSanitizer.sanitize(tag.getKey().getName()), tag.getValue());
      }
      labels.putAll(constLabels);
      labels.putAll(resourceLabels);
      List<String> values = new ArrayList<>(descriptor.getLabelNames().size());
      for (String labelName : descriptor.getLabelNames()) {
        String value = labels.get(labelName);
        values.add(value == null ? "" : value);
      }
      labeled.add(new LabeledRow(values, row.getData()));
    }
    labeled.sort(LabeledRow::compareTo);
    return labeled;
  }

  private static List<String> sampleNames(String name, Type type) {
    switch (type) {
      case COUNTER:
        return Collections.singletonList(name + TOTAL_SUFFIX);
      case HISTOGRAM:
        return Arrays.asList(name + BUCKET_SUFFIX, name + SUM_SUFFIX, name + COUNT_SUFFIX);
      default:
        return Collections.singletonList(name);
    }
  }

  private static Type toType(AggregationType aggregationType) {
    switch (aggregationType) {
      case COUNT:
        return Type.COUNTER;
      case SUM:
        return Type.UNKNOWN;
      case LAST_VALUE:
        return Type.GAUGE;
      case DISTRIBUTION:
        return Type.HISTOGRAM;
    }
    throw new IllegalArgumentException("Unsupported aggregation type: " + aggregationType);
  }

  private static Map<String, String> sanitizeKeys(Map<String, String> labels) {
    Map<String, String> result = new TreeMap<>();
    labels.forEach((key, value) -> result.put(NameSanitizer.sanitize(key), value));
    return Collections.unmodifiableMap(result);
  }

  private static final class LabeledRow implements Comparable<LabeledRow> {
    private final List<String> labelValues;
    private final AggregationData data;

    private LabeledRow(List<String> labelValues, AggregationData data) {
      this.labelValues = labelValues;
      this.data = data;
    }

    @Override
    public int compareTo(LabeledRow other) {
      for (int i = 0; i < labelValues.size() && i < other.labelValues.size(); i++) {
        int result = labelValues.get(i).compareTo(other.labelValues.get(i));
        if (result != 0) {
          return result;
        }
      }
      return Integer.compare(labelValues.size(), other.labelValues.size());
    }
  }

  /** Samples of one metric family, built up across the views that render to its name. */
  private static final class Family {
    private final SeriesDescriptor descriptor;
    private final Type type;
    private final List<MetricFamilySamples.Sample> samples = new ArrayList<>();
    private final Set<List<String>> seenLabelValues = new HashSet<>();

    private Family(SeriesDescriptor descriptor, Type type) {
      this.descriptor = descriptor;
      this.type = type;
    }

    void add(LabeledRow row) {
      if (!seenLabelValues.add(row.labelValues)) {
        throw new IllegalStateException(
            "collected metric \"" + descriptor.getName() + "\" with labels "
                + descriptor.getLabelNames() + "=" + row.labelValues
                + " was collected before with the same name and label values");
      }
      String name = descriptor.getName();
      List<String> labelNames = descriptor.getLabelNames();
      AggregationData data = row.data;
      switch (data.getType()) {
        case COUNT:
          samples.add(
              new MetricFamilySamples.Sample(
                  name + TOTAL_SUFFIX, labelNames, row.labelValues,
                  ((CountData) data).getCount()));
          return;
        case SUM:
          samples.add(
              new MetricFamilySamples.Sample(
                  name, labelNames, row.labelValues, ((SumData) data).getSum()));
          return;
        case LAST_VALUE:
          samples.add(
              new MetricFamilySamples.Sample(
                  name, labelNames, row.labelValues, ((LastValueData) data).getValue()));
          return;
        case DISTRIBUTION:
          addHistogram((DistributionData) data, row.labelValues);
          return;
      }
      throw new IllegalArgumentException("Unsupported aggregation data: " + data);
    }

    private void addHistogram(DistributionData data, List<String> labelValues) {
      String name = descriptor.getName();
      List<String> labelNames = descriptor.getLabelNames();
      List<String> bucketLabelNames = new ArrayList<>(labelNames);
      bucketLabelNames.add(LE_LABEL);

      List<Double> boundaries = data.getBucketBoundaries();
      List<Long> counts = data.getBucketCounts();
      long cumulative = 0;
      for (int i = 0; i < boundaries.size(); i++) {
        cumulative += counts.get(i);
        samples.add(
            new MetricFamilySamples.Sample(
                name + BUCKET_SUFFIX,
                bucketLabelNames,
                withLe(labelValues, Collector.doubleToGoString(boundaries.get(i))),
                cumulative));
      }
      samples.add(
          new MetricFamilySamples.Sample(
              name + BUCKET_SUFFIX,
              bucketLabelNames,
              withLe(labelValues, "+Inf"),
              data.getCount()));
      samples.add(
          new MetricFamilySamples.Sample(name + SUM_SUFFIX, labelNames, labelValues, data.getSum()));
      samples.add(
          new MetricFamilySamples.Sample(
              name + COUNT_SUFFIX, labelNames, labelValues, data.getCount()));
    }

    private static List<String> withLe(List<String> labelValues, String le) {
      List<String> values = new ArrayList<>(labelValues.size() + 1);
      values.addAll(labelValues);
      values.add(le);
      return values;
    }

    MetricFamilySamples toMetricFamilySamples() {
      return new MetricFamilySamples(descriptor.getName(), type, descriptor.getHelp(), samples);
    }
  }
}
