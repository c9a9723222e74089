package com.example.CommonSupplier.logic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * Builds the common supplier upload file: child suppliers are folded into their parent across
 * the BUT000, ADRC, LFA1, LFB1, LFM1 and WYT3 sheets, and every changed cell is highlighted.
 */
public class CommonSupplierLogic {

    private static final Logger log = LoggerFactory.getLogger(CommonSupplierLogic.class);

    private CommonSupplierLogic() {
    }

    public static List<SheetMutator> defaultMutators() {
        return List.of(
                new GeneralSheetMutator(),
                new AddressSheetMutator(),
                new SupplierGeneralSheetMutator(),
                AssociationSheetMutator.companyCode(),
                AssociationSheetMutator.purchasingOrg(),
                new PartnerFunctionSheetMutator()
        );
    }

    /**
     * Runs the merge on sheets already loaded in memory. The sheets are changed in place.
     *
     * @throws MissingSheetException before anything is changed, when a required sheet is absent
     */
    public static MergeResult merge(Map<String, SheetTable> sheets, IdentityClassifier classifier) {
        return merge(sheets, classifier, defaultMutators());
    }

    public static MergeResult merge(Map<String, SheetTable> sheets, IdentityClassifier classifier,
                                    List<SheetMutator> mutators) {
        for (String required : SheetNames.REQUIRED) {
            if (!sheets.containsKey(required)) {
                throw new MissingSheetException(required);
            }
        }

        SheetTable general = HeaderNormalizer.cleanHeaders(sheets.get(SheetNames.GENERAL));
        SupplierRegistry registry = classifier.classify(general);
        registry = RoleAnnotator.annotate(registry, HeaderNormalizer.cleanHeaders(sheets.get(SheetNames.ROLE)));

        MutationLedger ledger = new MutationLedger();
        for (SheetMutator mutator : mutators) {
            SheetTable table = sheets.get(mutator.getSheetName());
            if (table == null) {
                if (mutator.isRequired()) throw new MissingSheetException(mutator.getSheetName());
                log.info("{} not found (skipped).", mutator.getSheetName());
                continue;
            }
            mutator.apply(HeaderNormalizer.cleanHeaders(table), registry, ledger);
        }

        log.info("Merge complete: {} cells changed", ledger.size());
        return new MergeResult(sheets, registry, ledger);
    }

    public static byte[] generateUploadFile(byte[] preFile, String fileLabel, IdentityClassifier classifier,
                                            UploadFilePresenter presenter) {
        MergeResult result = merge(WorkbookReader.read(preFile, fileLabel), classifier);
        return toBytes(result, presenter, fileLabel);
    }

    public static byte[] toBytes(MergeResult result, UploadFilePresenter presenter, String fileLabel) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(result, presenter, out, fileLabel);
        return out.toByteArray();
    }

    /**
     * File based entry point. Nothing is written to {@code output} when the merge fails.
     */
    public static void generateUploadFile(File input, File output, IdentityClassifier classifier,
                                          UploadFilePresenter presenter) {
        MergeResult result;
        try (InputStream in = new FileInputStream(input)) {
            result = merge(WorkbookReader.read(in, input.getName()), classifier);
        } catch (IOException e) {
            throw new WorkbookProcessingException(input.getName(), WorkbookProcessingException.Phase.READ, e);
        }

        try (OutputStream out = new FileOutputStream(output)) {
            write(result, presenter, out, output.getName());
        } catch (IOException e) {
            throw new WorkbookProcessingException(output.getName(), WorkbookProcessingException.Phase.WRITE, e);
        }
        log.info("Processing complete. Output saved as: {}", output.getAbsolutePath());
    }

    private static void write(MergeResult result, UploadFilePresenter presenter, OutputStream out, String fileLabel) {
        try {
            presenter.write(result.getSheets().values(), result.getLedger(), out);
        } catch (IOException e) {
            throw new WorkbookProcessingException(fileLabel, WorkbookProcessingException.Phase.WRITE, e);
        }
    }
}
