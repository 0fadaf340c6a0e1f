package com.jijue.hospital_api.service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.RecordsBundle;
import com.jijue.hospital_api.model.MedicalRecord;
import com.jijue.hospital_api.model.Prescription;

/**
 * Writes a patient's records bundle as an .xls workbook, one sheet per section.
 */
@Service
public class RecordsExportService {

    private static final Logger logger = LoggerFactory.getLogger(RecordsExportService.class);

    private final PatientPortalService patientPortalService;

    public RecordsExportService(PatientPortalService patientPortalService) {
        this.patientPortalService = patientPortalService;
    }

    public String getExcelFilename(String patientId) {
        String safeId = patientId.replaceAll("[^a-zA-Z0-9\\-_]", "");
        return String.format("Medical_Records_%s.xls", safeId);
    }

    public ByteArrayInputStream generateRecordsExcel(String patientId) throws IOException {
        logger.info("Generating records workbook for patient {}", patientId);
        RecordsBundle bundle = patientPortalService.getRecordsBundle(patientId);

        try (Workbook workbook = new HSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle boldStyle = createBoldStyle(workbook);
            CellStyle wrappedStyle = createWrappedStyle(workbook);

            writePatientSheet(workbook, bundle.patient(), boldStyle);

            Sheet visits = createTableSheet(workbook, "Appointments", headerStyle,
                    "Appointment ID", "Date", "Time", "Doctor", "Reason", "Diagnosis", "Status");
            int rowIdx = 1;
            for (RecordsBundle.VisitEntry visit : bundle.appointments()) {
                Row row = visits.createRow(rowIdx++);
                row.createCell(0).setCellValue(text(visit.appointmentId()));
                row.createCell(1).setCellValue(text(visit.date()));
                row.createCell(2).setCellValue(text(visit.time()));
                row.createCell(3).setCellValue(text(visit.doctor()));
                Cell reason = row.createCell(4);
                reason.setCellValue(text(visit.reason()));
                reason.setCellStyle(wrappedStyle);
                row.createCell(5).setCellValue(text(visit.diagnosis()));
                row.createCell(6).setCellValue(text(visit.status()));
            }

            Sheet prescriptions = createTableSheet(workbook, "Prescriptions", headerStyle,
                    "Medication", "Dosage", "Frequency", "Status", "Refills Remaining", "Prescribed");
            rowIdx = 1;
            for (Prescription prescription : bundle.prescriptions()) {
                Row row = prescriptions.createRow(rowIdx++);
                row.createCell(0).setCellValue(text(prescription.getMedication()));
                row.createCell(1).setCellValue(text(prescription.getDosage()));
                row.createCell(2).setCellValue(text(prescription.getFrequency()));
                row.createCell(3).setCellValue(prescription.getStatus() != null ? prescription.getStatus().getValue() : "");
                row.createCell(4).setCellValue(prescription.getRefillsRemaining());
                row.createCell(5).setCellValue(text(prescription.getPrescribedDate()));
            }

            Sheet records = createTableSheet(workbook, "Medical Records", headerStyle,
                    "Visit Date", "Diagnosis", "Treatment", "Medications", "Notes");
            rowIdx = 1;
            for (MedicalRecord record : bundle.medicalRecords()) {
                Row row = records.createRow(rowIdx++);
                row.createCell(0).setCellValue(text(record.getVisitDate()));
                row.createCell(1).setCellValue(text(record.getDiagnosis()));
                Cell treatment = row.createCell(2);
                treatment.setCellValue(text(record.getTreatment()));
                treatment.setCellStyle(wrappedStyle);
                row.createCell(3).setCellValue(String.join(", ", record.getMedications()));
                Cell notes = row.createCell(4);
                notes.setCellValue(text(record.getNotes()));
                notes.setCellStyle(wrappedStyle);
            }

            workbook.write(out);
            logger.info("Records workbook generated for patient {}", patientId);
            return new ByteArrayInputStream(out.toByteArray());
        } catch (IOException e) {
            logger.error("Error generating records workbook for patient {}: {}", patientId, e.getMessage());
            throw e;
        }
    }

    private void writePatientSheet(Workbook workbook, RecordsBundle.PatientCard card, CellStyle labelStyle) {
        Sheet sheet = workbook.createSheet("Patient");
        sheet.setDefaultColumnWidth(25);

        Row titleRow = sheet.createRow(0);
        Cell titleCell = titleRow.createCell(0);
        titleCell.setCellValue("Medical Records - " + card.name());
        CellStyle titleStyle = workbook.createCellStyle();
        Font titleFont = workbook.createFont();
        titleFont.setBold(true);
        titleFont.setFontHeightInPoints((short) 14);
        titleStyle.setFont(titleFont);
        titleCell.setCellStyle(titleStyle);
        sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, 1));

        String[][] fields = {
                {"Name", card.name()},
                {"Patient ID", card.patientId()},
                {"Date of Birth", text(card.dateOfBirth())},
                {"Blood Type", card.bloodType()},
                {"Gender", card.gender()},
                {"Phone", card.phone()},
                {"Email", card.email()},
        };
        int rowIdx = 2;
        for (String[] field : fields) {
            Row row = sheet.createRow(rowIdx++);
            Cell label = row.createCell(0);
            label.setCellValue(field[0]);
            label.setCellStyle(labelStyle);
            row.createCell(1).setCellValue(text(field[1]));
        }
    }

    private Sheet createTableSheet(Workbook workbook, String name, CellStyle headerStyle, String... columns) {
        Sheet sheet = workbook.createSheet(name);
        sheet.setDefaultColumnWidth(20);
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < columns.length; i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(columns[i]);
            cell.setCellStyle(headerStyle);
        }
        return sheet;
    }

    private static String text(Object value) {
        return Objects.toString(value, "");
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.ROYAL_BLUE.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    private CellStyle createBoldStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    private CellStyle createWrappedStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setWrapText(true);
        style.setVerticalAlignment(VerticalAlignment.TOP);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    private void setBorder(CellStyle style, BorderStyle borderStyle) {
        style.setBorderBottom(borderStyle);
        style.setBorderTop(borderStyle);
        style.setBorderLeft(borderStyle);
        style.setBorderRight(borderStyle);
    }
}
