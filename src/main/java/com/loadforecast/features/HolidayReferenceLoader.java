package com.loadforecast.features;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code date,name} CSV files with a header row. Dates are ISO {@code yyyy-MM-dd}.
 */
@Slf4j
@Component
public class HolidayReferenceLoader {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    public List<Holiday> load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            MappingIterator<HolidayRecord> rows = csvMapper.readerFor(HolidayRecord.class).with(schema).readValues(in);
            List<Holiday> holidays = new ArrayList<>();
            while (rows.hasNext()) {
                HolidayRecord row = rows.next();
                holidays.add(new Holiday(parseDate(row, resource), row.name().trim()));
            }
            log.info("Loaded {} holiday records from {}", holidays.size(), resource.getDescription());
            return holidays;
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not read holiday reference data " + resource.getDescription(), ex);
        }
    }

    private LocalDate parseDate(HolidayRecord row, Resource resource) {
        try {
            return LocalDate.parse(row.date().trim());
        } catch (DateTimeParseException | NullPointerException ex) {
            throw new IllegalArgumentException("Invalid date '" + row.date() + "' in " + resource.getDescription(), ex);
        }
    }

    public record Holiday(LocalDate date, String name) {}
}
