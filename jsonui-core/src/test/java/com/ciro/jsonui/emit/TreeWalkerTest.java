package com.ciro.jsonui.emit;

import com.ciro.jsonui.Diagnostic;
import com.ciro.jsonui.Diagnostics;
import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.ast.LayoutReader;
import com.ciro.jsonui.binding.BindingResolver;
import com.ciro.jsonui.binding.VisibilityResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TreeWalkerTest {

    private final LayoutReader reader = new LayoutReader();
    private final Diagnostics diagnostics = Diagnostics.forDocument("test");

    private EmitContext context(Set<String> knownDocuments) {
        return EmitContext.root(new BindingResolver(), new VisibilityResolver(), diagnostics, knownDocuments);
    }

    private String emit(String json) {
        return emit(json, EmitterRegistry.standard(), context(null));
    }

    private String emit(String json, EmitterRegistry registry, EmitContext ctx) {
        ComponentNode root = reader.read("test", json);
        return new TreeWalker(registry).walk(root, ctx);
    }

    private List<String> messages() {
        return diagnostics.entries().stream().map(Diagnostic::message).toList();
    }

    @Test
    void containerWithBoundLabel() {
        String out = emit("""
                {"type": "View", "width": 100, "child": [{"type": "Label", "text": "@{title}"}]}
                """);
        assertEquals("<div className=\"w-[100px] flex flex-col\">\n"
                + "  <span>{viewModel.data.title}</span>\n"
                + "</div>", out);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void goneWhenTrueWrapsWithNegatedCondition() {
        String out = emit("""
                {"type": "Label", "text": "x", "visibility": "@{isLast ? 'gone' : 'visible'}"}
                """);
        assertEquals("{!viewModel.data.isLast && (\n  <span>x</span>\n)}", out);
    }

    @Test
    void hiddenBindingWrapsWithNegatedCondition() {
        String out = emit("""
                {"type": "Label", "text": "x", "hidden": "@{collapsed}"}
                """);
        assertEquals("{!viewModel.data.collapsed && (\n  <span>x</span>\n)}", out);
    }

    @Test
    void invisibleFadesThroughInlineOpacity() {
        String out = emit("""
                {"type": "Label", "text": "x", "visibility": "@{shown ? 'visible' : 'invisible'}"}
                """);
        assertEquals("<span style={{ opacity: viewModel.data.shown ? 1 : 0 }}>x</span>", out);
    }

    @Test
    void unsupportedVisibilityShapeIsReportedAndRendered() {
        String out = emit("""
                {"type": "Label", "text": "x", "visibility": "@{count > 0 ? 'visible' : 'gone'}"}
                """);
        assertEquals("<span>x</span>", out);
        assertEquals(1, diagnostics.entries().size());
    }

    @Test
    void boundColorGoesToInlineStyle() {
        String out = emit("""
                {"type": "Label", "text": "x", "fontColor": "@{tint}", "fontSize": 14}
                """);
        assertEquals("<span className=\"text-sm\" style={{ color: viewModel.data.tint }}>x</span>", out);
    }

    @Test
    void wrongClickFormLeavesInlineComment() {
        String out = emit("""
                {"type": "Button", "text": "Go", "onClick": "tap"}
                """);
        assertTrue(out.startsWith("<button className=\"cursor-pointer transition-colors"));
        assertTrue(out.contains(" type=\"button\" /* jsonui: onClick expects @{...} binding, got 'tap' */>Go</button>"));
        assertEquals(List.of("onClick expects @{...} binding, got 'tap'"), messages());
    }

    @Test
    void buttonWithBindingsAndDisabledState() {
        String out = emit("""
                {"type": "Button", "text": "Save", "onClick": "@{onSave}", "enabled": "@{canSave}"}
                """);
        assertTrue(out.contains("onClick={viewModel.data.onSave}"));
        assertTrue(out.contains("disabled={!viewModel.data.canSave}"));
    }

    @Test
    void hrefWrapsButtonInLink() {
        EmitContext ctx = context(null);
        String out = emit("""
                {"type": "Button", "text": "About", "href": "/about"}
                """, EmitterRegistry.standard(), ctx);
        assertTrue(out.startsWith("<Link href=\"/about\">\n  <button "));
        assertTrue(out.endsWith(">About</button>\n</Link>"));
        assertTrue(ctx.usage().usesLink());
    }

    @Test
    void unknownTypeFallsBackToView() {
        assertEquals("<div />", emit("""
                {"type": "FancyWidget"}
                """));
        assertEquals(List.of("unknown type 'FancyWidget', emitted as View"), messages());
    }

    @Test
    void dataMarkersAreNeverRendered() {
        assertEquals("<div />", emit("""
                {"type": "View", "child": [{"data": [{"name": "title"}]}]}
                """));
    }

    @Test
    void includeBecomesComponentWithProps() {
        EmitContext ctx = context(null);
        String out = emit("""
                {"type": "View", "child": [
                  {"include": "common/header_bar", "data": {"title": "@{title}", "count": 3}}
                ]}
                """, EmitterRegistry.standard(), ctx);
        assertEquals("<div className=\"flex flex-col\">\n"
                + "  <HeaderBar title={viewModel.data.title} count={3} />\n"
                + "</div>", out);
        assertEquals(Set.of("HeaderBar"), ctx.usage().includes());
    }

    @Test
    void unknownIncludeIsCommentedOut() {
        String out = emit("""
                {"include": "missing"}
                """, EmitterRegistry.standard(), context(Set.of("home")));
        assertEquals("{/* jsonui: unknown include 'missing' */}", out);
        assertEquals(List.of("unknown include 'missing'"), messages());
    }

    @Test
    void textFieldGetsDefaultChangeHandler() {
        String out = emit("""
                {"type": "TextField", "text": "@{email}", "hint": "Email"}
                """);
        assertEquals("<input className=\"border outline-none focus:ring-2 focus:ring-blue-500\" type=\"text\""
                + " placeholder=\"Email\" value={viewModel.data.email}"
                + " onChange={(e) => viewModel.data.onEmailChange?.(e.target.value)} />", out);
    }

    @Test
    void explicitChangeHandlerWins() {
        String out = emit("""
                {"type": "TextField", "text": "@{email}", "onTextChange": "@{emailChanged}"}
                """);
        assertTrue(out.contains("onChange={(e) => viewModel.data.emailChanged?.(e.target.value)}"));
        assertFalse(out.contains("onEmailChange"));
    }

    @Test
    void switchIsCheckboxWithDefaultHandler() {
        String out = emit("""
                {"type": "Switch", "isOn": "@{notifications}"}
                """);
        assertEquals("<input className=\"cursor-pointer\" type=\"checkbox\" role=\"switch\""
                + " checked={viewModel.data.notifications}"
                + " onChange={(e) => viewModel.data.onNotificationsChange?.(e.target.checked)} />", out);
    }

    @Test
    void badPaddingArrayIsReportedAndIgnored() {
        assertEquals("<div />", emit("""
                {"type": "View", "padding": [1, 2, 3]}
                """));
        assertEquals(List.of("padding array must have 1, 2 or 4 values, got 3; ignored"), messages());
    }

    @Test
    void paddingArrayInEdgeOrder() {
        assertEquals("<div className=\"pt-2.5 pr-5 pb-7 pl-10\" />", emit("""
                {"type": "View", "padding": [10, 20, 30, 40]}
                """));
    }

    @Test
    void rowGravityMapsMainAxisToJustify() {
        String out = emit("""
                {"type": "View", "orientation": "horizontal", "gravity": "center", "spacing": 8,
                 "child": [{"type": "Label", "text": "a"}]}
                """);
        assertTrue(out.startsWith("<div className=\"flex flex-row justify-center items-center gap-2\">"));
    }

    @Test
    void childAlignmentFollowsParentOrientation() {
        String out = emit("""
                {"type": "View", "orientation": "horizontal",
                 "child": [{"type": "Label", "text": "a", "alignTop": true}]}
                """);
        assertTrue(out.contains("<span className=\"self-start\">a</span>"));
    }

    @Test
    void idAndTestAttributes() {
        assertEquals("<span id=\"title\" data-testid=\"t1\">x</span>", emit("""
                {"type": "Label", "id": "title", "testId": "t1", "text": "x"}
                """));
    }

    @Test
    void extensionComponentReceivesProps() {
        EmitContext ctx = context(null);
        String out = emit("""
                {"type": "Chart", "series": "@{points}", "padding": 8}
                """, EmitterRegistry.withExtensionComponents(List.of("Chart")), ctx);
        assertEquals("<Chart className=\"p-2\" series={viewModel.data.points} />", out);
        assertEquals(Set.of("Chart"), ctx.usage().extensions());
    }

    @Test
    void imageUsesAltAndObjectFit() {
        assertEquals("<img className=\"object-contain\" src={viewModel.data.avatar} alt=\"\" />", emit("""
                {"type": "Image", "src": "@{avatar}", "contentMode": "aspectFit"}
                """));
    }

    @Test
    void labelPartialAttributesBecomeInlineSpans() {
        assertEquals("<span>Read the <span className=\"text-[#0000FF] underline cursor-pointer\""
                + " onClick={viewModel.data.openTerms}>terms</span> now</span>", emit("""
                {"type": "Label", "text": "Read the terms now", "partialAttributes": [
                  {"range": [9, 14], "fontColor": "#0000FF", "underline": true, "onClick": "@{openTerms}"}
                ]}
                """));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void partialAttributesOnBoundTextAreIgnored() {
        assertEquals("<span>{viewModel.data.title}</span>", emit("""
                {"type": "Label", "text": "@{title}", "partialAttributes": [{"range": [0, 2], "fontWeight": "bold"}]}
                """));
        assertEquals(List.of("partialAttributes need a literal text; ignored"), messages());
    }

    @Test
    void buttonPartialAttributesKeepButtonWrapper() {
        String out = emit("""
                {"type": "Button", "text": "Sign up", "partialAttributes": [{"range": [5, 7], "fontWeight": "bold"}]}
                """);
        assertTrue(out.endsWith(">Sign <span className=\"font-bold\">up</span></button>"));
    }

    @Test
    void collectionSectionsIterateCellData() {
        EmitContext ctx = context(null);
        String out = emit("""
                {"type": "Collection", "id": "list", "items": "@{rows}", "columnCount": 2, "itemSpacing": 8,
                 "sections": [{"header": "section_header", "cell": {"className": "ItemRow"}}]}
                """, EmitterRegistry.standard(), ctx);
        assertEquals("<div id=\"list\" className=\"grid grid-cols-2 gap-2\">\n"
                + "  <SectionHeader />\n"
                + "  {viewModel.data.rows?.sections?.[0]?.cells?.data?.map((cellData, cellIndex) => (\n"
                + "    <ItemRow key={cellIndex} viewModel={{ data: cellData }} />\n"
                + "  ))}\n"
                + "</div>", out);
        assertEquals(Set.of("SectionHeader", "ItemRow"), ctx.usage().includes());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void legacyCellClassesMapOverItems() {
        String out = emit("""
                {"type": "Table", "cellClasses": ["ItemRow"], "items": "@{rows}"}
                """);
        assertTrue(out.contains("{viewModel.data.rows?.map((item, index) => (\n"
                + "    <ItemRow key={index} viewModel={{ data: item }} />\n"
                + "  ))}"));
        assertTrue(out.startsWith("<div className=\"flex flex-col\">"));
    }

    @Test
    void unknownCellLayoutIsCommentedOut() {
        String out = emit("""
                {"type": "Collection", "layout": "horizontal", "cellClasses": ["missing_row"], "items": "@{rows}"}
                """, EmitterRegistry.standard(), context(Set.of("home")));
        assertEquals("<div className=\"overflow-x-auto flex flex-row flex-nowrap\">\n"
                + "  {/* jsonui: unknown cell 'missing_row' */}\n"
                + "</div>", out);
        assertEquals(List.of("unknown cell layout 'missing_row'", "collection without cell layout"), messages());
    }

    @Test
    void sliderRangeWithDefaultHandler() {
        assertEquals("<input className=\"w-full cursor-pointer\" type=\"range\" min={0} max={10}"
                + " value={viewModel.data.volume}"
                + " onChange={(e) => viewModel.data.onVolumeChange?.(Number(e.target.value))} />", emit("""
                {"type": "Slider", "value": "@{volume}", "range": [0, 10]}
                """));
    }

    @Test
    void segmentButtonsCompareSelectedIndex() {
        String out = emit("""
                {"type": "Segment", "items": ["Day", "Week"], "selectedIndex": "@{tab}"}
                """);
        assertTrue(out.startsWith("<div className=\"w-full flex rounded-lg p-1 bg-gray-100\">"));
        assertTrue(out.contains("<button key={1} type=\"button\" className={`flex-1 px-4 py-2 text-sm font-medium"
                + " rounded-md transition-colors cursor-pointer ${viewModel.data.tab === 1 ? 'bg-white shadow'"
                + " : 'text-gray-500 hover:text-gray-700'}`} onClick={() => viewModel.data.onTabChange?.(1)}>Week</button>"));
    }

    @Test
    void radioItemsShareGroupName() {
        String out = emit("""
                {"type": "Radio", "id": "size", "items": ["S", "M"], "selectedValue": "@{size}"}
                """);
        assertTrue(out.startsWith("<div id=\"size\" className=\"flex flex-col gap-2\">"));
        assertTrue(out.contains("<input type=\"radio\" name=\"size\" value=\"M\""
                + " checked={viewModel.data.size === 'M'} onChange={() => viewModel.data.onSizeChange?.('M')} />"));
        assertTrue(out.contains("<span>S</span>"));
    }

    @Test
    void selectBoxWithBoundItems() {
        String out = emit("""
                {"type": "SelectBox", "items": "@{countries}", "selectedValue": "@{country}", "hint": "Pick"}
                """);
        assertTrue(out.startsWith("<select className=\"border rounded-md px-3 py-2 cursor-pointer\""
                + " value={viewModel.data.country} onChange={(e) => viewModel.data.onCountryChange?.(e.target.value)}>"));
        assertTrue(out.contains("<option value=\"\" disabled>Pick</option>"));
        assertTrue(out.contains("{viewModel.data.countries?.map((item) => ("));
    }

    @Test
    void selectBoxWithStaticItems() {
        String out = emit("""
                {"type": "SelectBox", "items": ["a", {"value": "b", "text": "Bee"}]}
                """);
        assertTrue(out.contains("<option value=\"a\">a</option>"));
        assertTrue(out.contains("<option value=\"b\">Bee</option>"));
    }

    @Test
    void progressReadsValueAndMaximum() {
        String out = emit("""
                {"type": "Progress", "progress": "@{ratio}", "maximumValue": 1}
                """);
        assertTrue(out.startsWith("<progress className=\"w-full h-2 rounded-full appearance-none"));
        assertTrue(out.contains("[&::-webkit-progress-value]:bg-blue-500"));
        assertTrue(out.endsWith(" value={viewModel.data.ratio} max={1} />"));
    }

    @Test
    void indicatorSpinnerSizeAndColor() {
        assertEquals("<div className=\"inline-flex items-center justify-center\" role=\"status\">\n"
                + "  <div className=\"w-8 h-8 animate-spin rounded-full border-2 border-transparent border-t-[#FF0000]\" />\n"
                + "</div>", emit("""
                {"type": "Indicator", "size": "large", "color": "#FF0000"}
                """));
    }

    @Test
    void webViewIsSandboxedIframe() {
        assertEquals("<iframe className=\"border-0\" src=\"https://example.com\""
                + " sandbox=\"allow-scripts allow-same-origin allow-forms allow-modals allow-downloads\" />", emit("""
                {"type": "Web", "url": "https://example.com", "allowsFullScreen": false}
                """));
    }

    @Test
    void iconLabelSwitchesIconOnSelection() {
        assertEquals("<div className=\"flex flex-col items-center\">\n"
                + "  <img className=\"mb-1\" src={viewModel.data.isHome ? 'home_on.png' : 'home.png'} alt=\"\" />\n"
                + "  <span>Home</span>\n"
                + "</div>", emit("""
                {"type": "IconLabel", "text": "Home", "icon_on": "home_on.png", "icon_off": "home.png",
                 "selected": "@{isHome}", "iconPosition": "top"}
                """));
    }

    @Test
    void gradientViewUsesLocationsAsStops() {
        assertEquals("<div style={{ backgroundImage: 'linear-gradient(to right, #000000 0%, #FFFFFF 50%)' }} />", emit("""
                {"type": "GradientView", "gradient": ["#000000", "#FFFFFF"], "locations": [0, 0.5],
                 "gradientDirection": "horizontal"}
                """));
    }

    @Test
    void blurEffectStyleSetsBackdropFilter() {
        assertEquals("<div style={{ backdropFilter: 'blur(8px)', WebkitBackdropFilter: 'blur(8px)',"
                + " backgroundColor: 'rgba(255, 255, 255, 0.5)' }} />", emit("""
                {"type": "Blur", "effectStyle": "thin"}
                """));
    }

    @Test
    void circleViewClipsAndCentersChildren() {
        String out = emit("""
                {"type": "CircleView", "fillColor": "#FF0000", "strokeWidth": 2,
                 "child": [{"type": "Label", "text": "A"}]}
                """);
        assertTrue(out.startsWith("<div className=\"flex flex-col rounded-full overflow-hidden items-center"
                + " justify-center bg-[#FF0000] border-2 border-[#000000]\">"));
    }
}
