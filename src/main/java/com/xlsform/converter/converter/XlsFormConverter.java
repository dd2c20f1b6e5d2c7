package com.xlsform.converter.converter;

import java.util.List;

import com.xlsform.converter.choices.ChoiceOriginBuilder;
import com.xlsform.converter.choices.ChoiceOrigins;
import com.xlsform.converter.model.form.AjfForm;
import com.xlsform.converter.model.form.FormNode;
import com.xlsform.converter.model.form.GroupNode;
import com.xlsform.converter.model.form.NodeType;
import com.xlsform.converter.model.input.ChoiceRow;
import com.xlsform.converter.model.input.SurveyRow;
import com.xlsform.converter.model.input.XlsForm;
import com.xlsform.converter.parser.FormTreeBuilder;
import com.xlsform.converter.parser.StructurePreprocessor;
import com.xlsform.converter.validation.ChoiceReferenceValidator;

/**
 * Converts survey and choice rows into an {@link AjfForm}.
 *
 * Conversion only: no I/O and no logging. Every instance is stateless, so one
 * converter may serve concurrent conversions.
 */
public class XlsFormConverter {

    private final ChoiceOriginBuilder choiceOriginBuilder = new ChoiceOriginBuilder();
    private final StructurePreprocessor preprocessor = new StructurePreprocessor();
    private final FormTreeBuilder treeBuilder = new FormTreeBuilder();
    private final ChoiceReferenceValidator referenceValidator = new ChoiceReferenceValidator();
    private final IdAssigner idAssigner = new IdAssigner();

    public AjfForm convert(XlsForm form) {
        return convert(form.getSurveyRows(), form.getChoiceRows());
    }

    /**
     * @throws ConversionException on the first structural, type, reference or value error
     */
    public AjfForm convert(List<SurveyRow> surveyRows, List<ChoiceRow> choiceRows) {
        ChoiceOrigins choiceOrigins = choiceOriginBuilder.build(choiceRows);

        List<SurveyRow> rows = preprocessor.preprocess(surveyRows);
        GroupNode global = treeBuilder.build(rows);

        referenceValidator.validate(global, choiceOrigins);

        List<FormNode> slides = List.copyOf(global.getChildren());
        for (FormNode slide : slides) {
            if (slide instanceof GroupNode group && group.getNodeType() == NodeType.GROUP) {
                group.setSlide(true);
            }
        }
        idAssigner.assignIds(slides);

        return AjfForm.builder()
                .choicesOrigins(choiceOrigins.getOrigins())
                .slides(slides)
                .build();
    }
}
